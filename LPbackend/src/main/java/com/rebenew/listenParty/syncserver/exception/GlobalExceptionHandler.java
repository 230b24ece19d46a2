package com.rebenew.listenParty.syncserver.exception;

import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.error.RoomException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Traduce las excepciones de los endpoints REST a respuestas de error uniformes.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RoomException.class)
    public ResponseEntity<Map<String, Object>> handleRoomException(RoomException ex, WebRequest request) {
        HttpStatus status = statusFor(ex.getErrorCode());
        log.warn("⚠️ Operación rechazada [{}]: {}", ex.getCode(), ex.getMessage());

        Map<String, Object> errorResponse = buildErrorResponse(status, ex.getCode(), ex.getMessage(),
                request.getDescription(false));
        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * Cabeceras o parámetros ausentes y cuerpos mal formados
     */
    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, WebRequest request) {
        log.error("❌ Invalid request: {}", ex.getMessage());

        Map<String, Object> errorResponse = buildErrorResponse(HttpStatus.BAD_REQUEST,
                ErrorCode.VALIDATION_ERROR.getCode(), ex.getMessage(), request.getDescription(false));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGlobalException(Exception ex, WebRequest request) {
        log.error("💥 Unexpected error: {}", ex.getMessage(), ex);

        Map<String, Object> errorResponse = buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "internal_error", "Ocurrió un error inesperado", request.getDescription(false));
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    static HttpStatus statusFor(ErrorCode code) {
        switch (code) {
            case ROOM_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case PERMISSION_DENIED:
            case NOT_MASTER:
                return HttpStatus.FORBIDDEN;
            case NOT_CONNECTED:
                return HttpStatus.CONFLICT;
            case VALIDATION_ERROR:
            case OUT_OF_RANGE:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private Map<String, Object> buildErrorResponse(HttpStatus status, String code, String message, String path) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now().toString());
        errorResponse.put("status", status.value());
        errorResponse.put("error", code);
        errorResponse.put("message", message);
        errorResponse.put("path", path.replace("uri=", ""));
        return errorResponse;
    }
}

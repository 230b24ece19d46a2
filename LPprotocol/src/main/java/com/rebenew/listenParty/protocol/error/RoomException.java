package com.rebenew.listenParty.protocol.error;

/**
 * Excepción de dominio para operaciones de sala.
 */
public class RoomException extends RuntimeException {

    private final ErrorCode errorCode;

    public RoomException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public RoomException(ErrorCode errorCode, String details) {
        super(errorCode.getMessage() + ": " + details);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getCode() {
        return errorCode.getCode();
    }

    public static RoomException roomNotFound(String roomId) {
        return new RoomException(ErrorCode.ROOM_NOT_FOUND, roomId);
    }

    public static RoomException permissionDenied(String details) {
        return new RoomException(ErrorCode.PERMISSION_DENIED, details);
    }

    public static RoomException validation(String details) {
        return new RoomException(ErrorCode.VALIDATION_ERROR, details);
    }

    public static RoomException outOfRange(int index, int size) {
        return new RoomException(ErrorCode.OUT_OF_RANGE, "índice " + index + " con tamaño " + size);
    }
}

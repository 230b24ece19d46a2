package com.rebenew.listenParty.protocol.error;

/**
 * Errores locales y recuperables: ninguno cambia el estado de la sala
 * y solo se reportan a quien originó la operación.
 */
public enum ErrorCode {
    ROOM_NOT_FOUND("room_not_found", "La sala no existe o fue disuelta"),
    PERMISSION_DENIED("permission_denied", "Sin permisos para esta operación"),
    NOT_MASTER("not_master", "Solo el master puede reportar la reproducción"),
    VALIDATION_ERROR("validation_error", "Datos inválidos"),
    OUT_OF_RANGE("out_of_range", "Posición fuera de rango"),
    NOT_CONNECTED("not_connected", "No hay conexión con la sala");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}

package com.rebenew.listenParty.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberMode {
    /** Solo chat, sin seguir la reproducción. */
    CHAT("chat"),
    /** Escucha sincronizada con el master. */
    LISTEN("listen");

    private final String value;

    MemberMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MemberMode fromValue(String value) {
        for (MemberMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Modo desconocido: " + value);
    }
}

package com.rebenew.listenParty.protocol.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SongSource {
    NETEASE("netease"),
    LOCAL("local");

    private final String value;

    SongSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SongSource fromValue(String value) {
        for (SongSource source : values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Fuente desconocida: " + value);
    }

    /**
     * Deduce la fuente a partir del prefijo del songId ("netease_123", "local_9").
     * Devuelve null si el prefijo no es reconocido.
     */
    public static SongSource fromSongId(String songId) {
        if (songId == null)
            return null;
        for (SongSource source : values()) {
            if (songId.startsWith(source.value + "_")) {
                return source;
            }
        }
        return null;
    }
}

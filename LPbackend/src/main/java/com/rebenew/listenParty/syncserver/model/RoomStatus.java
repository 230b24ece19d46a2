package com.rebenew.listenParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RoomStatus {
    ACTIVE, // aceptando operaciones
    DISBANDED; // disuelta por el owner, terminal

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}

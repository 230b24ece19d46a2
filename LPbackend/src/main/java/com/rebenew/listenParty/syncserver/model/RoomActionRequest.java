package com.rebenew.listenParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.rebenew.listenParty.protocol.model.MemberMode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Cuerpo común de join, leave, mode, transfer y control.
 * Cada endpoint usa solo los campos que necesita.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RoomActionRequest {
    private String roomId;
    private MemberMode mode;       // POST /mode
    private String userId;         // POST /transfer, POST /control: miembro destino
    private Boolean canControl;    // POST /control

    public RoomActionRequest(String roomId) {
        this.roomId = roomId;
    }
}

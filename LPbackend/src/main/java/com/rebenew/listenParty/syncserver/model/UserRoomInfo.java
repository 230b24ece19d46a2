package com.rebenew.listenParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Entrada de GET /api/rooms/my
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UserRoomInfo {
    private String id;
    private String name;
    private String ownerId;
    private String ownerName;
    private int memberCount;
    @JsonProperty("isOwner")
    private boolean owner;
    private long joinedAt;
    private RoomStatus status;
}

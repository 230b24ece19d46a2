package com.rebenew.listenParty.syncserver.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * DTO para respuestas API - descriptor de la sala
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RoomResponse {
    private String id;
    private String name;
    private String ownerId;
    private String ownerName;
    private RoomStatus status;
    private long createdAt;
    private int memberCount;
    private int maxMembers;
}

package com.rebenew.listenParty.syncserver.model;

import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class CreateRoomRequest {
    private String name;

    public CreateRoomRequest() {}

    public CreateRoomRequest(String name) {
        this.name = name;
    }
}

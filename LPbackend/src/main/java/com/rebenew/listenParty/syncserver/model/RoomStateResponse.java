package com.rebenew.listenParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebenew.listenParty.protocol.model.MemberView;
import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * Estado completo de la sala para un miembro: se envía al unirse,
 * al autenticar el WebSocket y en cada resincronización.
 */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomStateResponse {
    private final RoomResponse room;
    private final List<MemberView> members;
    private final List<PlaylistItem> playlist;
    private final PlaybackSnapshot playback;
    private final String masterId;
    private final MemberView you;
}

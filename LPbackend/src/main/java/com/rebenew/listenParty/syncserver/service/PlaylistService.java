package com.rebenew.listenParty.syncserver.service;

import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import com.rebenew.listenParty.syncserver.core.PermissionGate;
import com.rebenew.listenParty.syncserver.core.RoomSessionManager;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Ediciones de la playlist compartida. Cada cambio aceptado difunde la playlist completa.
 */
@Service
public class PlaylistService {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistService.class);

    private final RoomSessionManager roomSessionManager;
    private final Clock clock;

    public PlaylistService(RoomSessionManager roomSessionManager, Clock clock) {
        this.roomSessionManager = roomSessionManager;
        this.clock = clock;
    }

    public CompletableFuture<PlaylistItem> addSong(String roomId, String userId, PlaylistItem song) {
        return roomSessionManager.execute(roomId, room -> {
            Member member = room.getMember(userId);
            PermissionGate.check(member, RoomOperation.ADD_SONG);
            if (song == null) {
                throw RoomException.validation("falta la canción");
            }

            PlaylistItem added = room.getPlaylist().add(song, userId, clock.millis());
            roomSessionManager.broadcastPlaylist(room);
            logger.debug("🎵 Song added to room {}: '{}' at {} by {}", roomId, added.name(), added.position(), userId);
            return added;
        });
    }

    public CompletableFuture<PlaylistItem> removeSong(String roomId, String userId, int position) {
        return roomSessionManager.execute(roomId, room -> {
            PermissionGate.check(room.getMember(userId), RoomOperation.REMOVE_SONG);

            PlaylistItem removed = room.getPlaylist().remove(position);
            roomSessionManager.broadcastPlaylist(room);
            logger.debug("🗑️ Song removed from room {}: index {} by {}", roomId, position, userId);
            return removed;
        });
    }

    public CompletableFuture<PlaylistItem> reorderSong(String roomId, String userId, int from, int to) {
        return roomSessionManager.execute(roomId, room -> {
            PermissionGate.check(room.getMember(userId), RoomOperation.REORDER_SONG);

            PlaylistItem moved = room.getPlaylist().reorder(from, to);
            roomSessionManager.broadcastPlaylist(room);
            logger.debug("🔀 Song moved in room {}: from {} to {} by {}", roomId, from, to, userId);
            return moved;
        });
    }

    public CompletableFuture<List<PlaylistItem>> getPlaylist(String roomId, String userId) {
        return roomSessionManager.execute(roomId, room -> {
            room.requireMember(userId);
            return room.getPlaylist().getItems();
        });
    }
}

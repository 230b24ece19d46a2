package com.rebenew.listenParty.syncserver.service;

import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.syncserver.core.PermissionGate;
import com.rebenew.listenParty.syncserver.core.RoomSessionManager;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomOperation;
import com.rebenew.listenParty.syncserver.model.RoomSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lado servidor del protocolo de snapshots: acepta reportes del master,
 * los reenvía a los seguidores y atiende las peticiones de estado.
 * El servidor nunca mueve el reproductor del master; solo le reenvía comandos.
 */
@Service
public class PlaybackService {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackService.class);

    private final RoomSessionManager roomSessionManager;
    private final Clock clock;

    public PlaybackService(RoomSessionManager roomSessionManager, Clock clock) {
        this.roomSessionManager = roomSessionManager;
        this.clock = clock;
    }

    public CompletableFuture<PlaybackSnapshot> reportPlayback(String roomId, String userId, PlaybackSnapshot report) {
        return roomSessionManager.execute(roomId, room -> {
            Member reporter = room.getMember(userId);
            PermissionGate.check(reporter, RoomOperation.REPORT_PLAYBACK);
            if (report == null || report.getSongId() == null || report.getSongId().isBlank()) {
                throw RoomException.validation("el snapshot necesita songId");
            }

            PlaybackSnapshot stamped = report.toBuilder()
                    .positionSeconds(Math.max(0d, report.getPositionSeconds()))
                    .reportedAt(clock.millis())
                    .masterId(reporter.getUserId())
                    .masterName(reporter.getUsername())
                    .build();
            room.setLastSnapshot(stamped);

            SyncMsg sync = SyncMsg.of(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_MASTER_SYNC, roomId, stamped);
            int relayed = 0;
            for (Member follower : room.getFollowers()) {
                if (roomSessionManager.sendToMember(room, follower.getUserId(), sync))
                    relayed++;
            }
            logger.debug("🎵 Snapshot {} in room {} relayed to {} followers", stamped, roomId, relayed);
            return stamped;
        });
    }

    public CompletableFuture<PlaybackSnapshot> requestPlayback(String roomId, String userId) {
        return roomSessionManager.execute(roomId, room -> requestPlayback(room, room.requireMember(userId)));
    }

    /**
     * Con master activo se le pide un reporte inmediato; si no, el seguidor recibe
     * el último snapshot guardado (congelado). Debe llamarse desde la cola de la sala.
     */
    PlaybackSnapshot requestPlayback(RoomSession room, Member requester) {
        Member master = room.getActiveMaster();
        if (master != null && !master.getUserId().equals(requester.getUserId())) {
            Map<String, Object> data = new HashMap<>();
            data.put("requesterId", requester.getUserId());
            roomSessionManager.sendToMember(room, master.getUserId(),
                    SyncMsg.of(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_MASTER_REQUEST, room.getRoomId(), data));
            logger.debug("📡 master_request forwarded to {} for {} in room {}", master.getUserId(),
                    requester.getUserId(), room.getRoomId());
            return room.getLastSnapshot();
        }

        PlaybackSnapshot last = room.getLastSnapshot();
        if (last != null) {
            roomSessionManager.sendToMember(room, requester.getUserId(),
                    SyncMsg.of(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_MASTER_SYNC, room.getRoomId(), last));
            logger.debug("🧊 No active master in room {}, sent stored snapshot to {}", room.getRoomId(),
                    requester.getUserId());
        }
        return last;
    }

    /**
     * Reenvía al master un comando de control (play, pause, seek, next, prev, play_song).
     */
    public CompletableFuture<Void> controlPlayback(String roomId, String userId, String command,
            Double positionSeconds, Integer songPosition) {
        return roomSessionManager.execute(roomId, room -> {
            RoomOperation operation = RoomOperation.fromCommand(command);
            if (operation == null) {
                throw RoomException.validation("comando desconocido: " + command);
            }
            Member actor = room.getMember(userId);
            PermissionGate.check(actor, operation);

            Map<String, Object> data = new HashMap<>();
            data.put("command", command);
            data.put("requestedBy", userId);
            if (MessageTypes.COMMAND_SEEK.equals(command)) {
                if (positionSeconds == null || positionSeconds < 0) {
                    throw RoomException.validation("seek necesita positionSeconds >= 0");
                }
                data.put("positionSeconds", positionSeconds);
            }
            if (MessageTypes.COMMAND_PLAY_SONG.equals(command)) {
                if (songPosition == null) {
                    throw RoomException.validation("play_song necesita la posición de la canción");
                }
                data.put("song", room.getPlaylist().get(songPosition));
                data.put("songPosition", songPosition);
            }

            Member master = room.getActiveMaster();
            if (master == null) {
                throw RoomException.validation("no hay master activo");
            }
            roomSessionManager.sendToMember(room, master.getUserId(),
                    SyncMsg.of(MessageTypes.PLAYBACK, MessageTypes.PLAYBACK_CONTROL, roomId, data));
            logger.info("🎛️ Control '{}' forwarded to master {} in room {} (by {})", command, master.getUserId(),
                    roomId, userId);
            return null;
        });
    }

    public CompletableFuture<PlaybackSnapshot> getSnapshot(String roomId, String userId) {
        return roomSessionManager.execute(roomId, room -> {
            room.requireMember(userId);
            return room.getLastSnapshot();
        });
    }
}

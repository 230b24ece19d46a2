package com.rebenew.listenParty.syncserver.controller;

import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.ChatMessageView;
import com.rebenew.listenParty.protocol.model.MemberView;
import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import com.rebenew.listenParty.syncserver.model.CreateRoomRequest;
import com.rebenew.listenParty.syncserver.model.RoomActionRequest;
import com.rebenew.listenParty.syncserver.model.RoomResponse;
import com.rebenew.listenParty.syncserver.model.RoomStateResponse;
import com.rebenew.listenParty.syncserver.model.UserRoomInfo;
import com.rebenew.listenParty.syncserver.service.ChatService;
import com.rebenew.listenParty.syncserver.service.MembershipService;
import com.rebenew.listenParty.syncserver.service.PlaybackService;
import com.rebenew.listenParty.syncserver.service.PlaylistService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Controlador REST de salas de escucha.
 * La identidad del usuario llega del gateway en las cabeceras X-User-Id / X-Username.
 *
 * Flujo principal:
 * 1. Owner crea sala → 2. Comparte el código de 6 dígitos → 3. Los demás se unen
 * y abren el canal /ws/room
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomController {
    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USERNAME_HEADER = "X-Username";
    static final String AVATAR_HEADER = "X-User-Avatar";

    private final MembershipService membershipService;
    private final PlaylistService playlistService;
    private final PlaybackService playbackService;
    private final ChatService chatService;

    public RoomController(MembershipService membershipService, PlaylistService playlistService,
            PlaybackService playbackService, ChatService chatService) {
        this.membershipService = membershipService;
        this.playlistService = playlistService;
        this.playbackService = playbackService;
        this.chatService = chatService;
    }

    /**
     * Crea una sala; el creador queda como owner.
     *
     * @param request {"name": "Viernes"}
     * @return descriptor de la sala con su id de 6 dígitos
     */
    @PostMapping
    public ResponseEntity<RoomResponse> create(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(USERNAME_HEADER) String username,
            @RequestHeader(value = AVATAR_HEADER, required = false) String avatar,
            @RequestBody CreateRoomRequest request) {
        logger.info("📝 Solicitud de creación de sala '{}' por {}", request.getName(), userId);
        RoomResponse room = membershipService.createRoom(userId, username, avatar, request.getName());
        return ResponseEntity.ok(room);
    }

    @GetMapping("/my")
    public ResponseEntity<List<UserRoomInfo>> myRooms(@RequestHeader(USER_ID_HEADER) String userId) {
        return ResponseEntity.ok(membershipService.getMyRooms(userId));
    }

    @PostMapping("/join")
    public ResponseEntity<RoomStateResponse> join(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestHeader(USERNAME_HEADER) String username,
            @RequestHeader(value = AVATAR_HEADER, required = false) String avatar,
            @RequestBody RoomActionRequest request) {
        logger.info("🚪 {} se une a la sala {}", userId, request.getRoomId());
        return ResponseEntity.ok(await(membershipService.join(request.getRoomId(), userId, username, avatar)));
    }

    @PostMapping("/leave")
    public ResponseEntity<Map<String, String>> leave(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestBody RoomActionRequest request) {
        await(membershipService.leave(request.getRoomId(), userId));
        return ResponseEntity.ok(Map.of("status", "left"));
    }

    /**
     * Disuelve la sala (solo owner). Todos los miembros reciben room/disband.
     */
    @DeleteMapping("/{roomId}")
    public ResponseEntity<Map<String, String>> disband(
            @RequestHeader(USER_ID_HEADER) String userId,
            @PathVariable String roomId) {
        logger.info("🗑️ Solicitud de disolución de sala {} por {}", roomId, userId);
        await(membershipService.disband(roomId, userId));
        return ResponseEntity.ok(Map.of("status", "disbanded"));
    }

    @GetMapping("/{roomId}")
    public ResponseEntity<RoomStateResponse> getRoom(
            @RequestHeader(USER_ID_HEADER) String userId,
            @PathVariable String roomId) {
        return ResponseEntity.ok(await(membershipService.getRoomState(roomId, userId)));
    }

    @GetMapping("/{roomId}/playlist")
    public ResponseEntity<List<PlaylistItem>> getPlaylist(
            @RequestHeader(USER_ID_HEADER) String userId,
            @PathVariable String roomId) {
        return ResponseEntity.ok(await(playlistService.getPlaylist(roomId, userId)));
    }

    /**
     * Último snapshot del master; 204 si aún no hubo reportes.
     */
    @GetMapping("/{roomId}/playback")
    public ResponseEntity<PlaybackSnapshot> getPlayback(
            @RequestHeader(USER_ID_HEADER) String userId,
            @PathVariable String roomId) {
        PlaybackSnapshot snapshot = await(playbackService.getSnapshot(roomId, userId));
        if (snapshot == null) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.ok(snapshot);
    }

    @GetMapping("/{roomId}/messages")
    public ResponseEntity<List<ChatMessageView>> getMessages(
            @RequestHeader(USER_ID_HEADER) String userId,
            @PathVariable String roomId,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(chatService.getHistory(roomId, userId, limit));
    }

    @PostMapping("/mode")
    public ResponseEntity<MemberView> setMode(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestBody RoomActionRequest request) {
        return ResponseEntity.ok(await(membershipService.setMode(request.getRoomId(), userId, request.getMode())));
    }

    /**
     * Concede o retira el permiso de control a un miembro (solo owner).
     *
     * @param request {"roomId": "123456", "userId": "u2", "canControl": true}
     */
    @PostMapping("/control")
    public ResponseEntity<MemberView> grantControl(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestBody RoomActionRequest request) {
        boolean canControl = request.getCanControl() == null || request.getCanControl();
        return ResponseEntity.ok(await(membershipService.grantControl(request.getRoomId(), userId,
                request.getUserId(), canControl)));
    }

    @PostMapping("/transfer")
    public ResponseEntity<Map<String, String>> transferOwner(
            @RequestHeader(USER_ID_HEADER) String userId,
            @RequestBody RoomActionRequest request) {
        await(membershipService.transferOwner(request.getRoomId(), userId, request.getUserId()));
        return ResponseEntity.ok(Map.of("status", "transferred"));
    }

    // Las operaciones corren en la cola de la sala; REST espera el resultado
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RoomException) {
                throw (RoomException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw e;
        }
    }
}

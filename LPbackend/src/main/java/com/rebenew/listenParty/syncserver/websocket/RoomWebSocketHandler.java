package com.rebenew.listenParty.syncserver.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.PlaybackSnapshot;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import com.rebenew.listenParty.protocol.model.SongSource;
import com.rebenew.listenParty.syncserver.config.RoomProperties;
import com.rebenew.listenParty.syncserver.core.RoomSessionManager;
import com.rebenew.listenParty.syncserver.service.ChatService;
import com.rebenew.listenParty.syncserver.service.MembershipService;
import com.rebenew.listenParty.syncserver.service.PlaybackService;
import com.rebenew.listenParty.syncserver.service.PlaylistService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Canal persistente de la sala. El primer mensaje debe ser 'auth'; el resto se
 * traduce a operaciones de los servicios y se responde con ack o error
 * correlacionados por correlationId.
 */
@Component
public class RoomWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(RoomWebSocketHandler.class);

    private final RoomSessionManager sessionManager;
    private final MembershipService membershipService;
    private final PlaylistService playlistService;
    private final PlaybackService playbackService;
    private final ChatService chatService;
    private final ObjectMapper objectMapper;
    private final RoomProperties properties;

    // Sesiones de usuario
    private final ConcurrentMap<String, UserSession> userSessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ws-sweeper");
        t.setDaemon(true);
        return t;
    });

    public RoomWebSocketHandler(RoomSessionManager sessionManager, MembershipService membershipService,
            PlaylistService playlistService, PlaybackService playbackService, ChatService chatService,
            ObjectMapper objectMapper, RoomProperties properties) {
        this.sessionManager = sessionManager;
        this.membershipService = membershipService;
        this.playlistService = playlistService;
        this.playbackService = playbackService;
        this.chatService = chatService;
        this.objectMapper = objectMapper;
        this.properties = properties;
        startSweeper();
        logger.info("✅ RoomWebSocketHandler inicializado");
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        logger.info("🔄 Nueva conexión WebSocket: {}", session.getId());
        userSessions.put(session.getId(), new UserSession(session));
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        UserSession userSession = userSessions.get(session.getId());
        if (userSession != null) {
            userSession.updateActivity();
        }

        SyncMsg syncMsg;
        try {
            syncMsg = objectMapper.readValue(message.getPayload(), SyncMsg.class);
        } catch (Exception e) {
            logger.error("❌ Error parseando mensaje: {}", e.getMessage());
            sessionManager.sendError(session, "invalid_message", "mensaje no válido", null);
            return;
        }
        processMessage(session, userSession, syncMsg);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        UserSession userSession = userSessions.remove(session.getId());
        if (userSession != null && userSession.roomId != null) {
            disconnectQuietly(userSession.roomId, userSession.userId, session);
            logger.info("🔌 Conexión cerrada: {} - Sala: {} ({})", session.getId(), userSession.roomId, status);
        } else {
            logger.info("🔌 Conexión cerrada: {}", session.getId());
        }
    }

    private void disconnectQuietly(String roomId, String userId, WebSocketSession session) {
        membershipService.disconnect(roomId, userId, session)
                .whenComplete((ignored, ex) -> {
                    if (ex != null) {
                        logger.debug("Desconexión sin efecto en sala {}: {}", roomId, unwrap(ex).getMessage());
                    }
                });
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== PROCESAMIENTO PRINCIPAL ====================

    private void processMessage(WebSocketSession session, UserSession userSession, SyncMsg msg) {
        String type = msg.getType();
        String correlationId = msg.getCorrelationId();

        if (type == null || msg.getRoomId() == null || msg.getSenderId() == null) {
            sessionManager.sendError(session, "missing_required_fields", "type, roomId y senderId son obligatorios",
                    correlationId);
            return;
        }

        if (!MessageTypes.AUTH.equals(type) && !validateSession(userSession, msg)) {
            sessionManager.sendError(session, "invalid_session", "sesión no autenticada para esta sala",
                    correlationId);
            return;
        }

        try {
            switch (type) {
                case MessageTypes.AUTH:
                    handleAuthentication(session, msg);
                    break;
                case MessageTypes.HEARTBEAT:
                    sessionManager.sendAck(session, true, "heartbeat_received", correlationId);
                    break;
                case MessageTypes.SYNC:
                    handleSyncRequest(session, msg);
                    break;
                case MessageTypes.MODE:
                    handleMode(session, msg);
                    break;
                case MessageTypes.PLAYLIST:
                    handlePlaylistManagement(session, msg);
                    break;
                case MessageTypes.PLAYBACK:
                    handlePlayback(session, msg);
                    break;
                case MessageTypes.MEMBER:
                    handleMemberManagement(session, msg);
                    break;
                case MessageTypes.CHAT:
                    handleChat(session, msg);
                    break;
                case MessageTypes.ROOM:
                    handleRoomLifecycle(session, msg);
                    break;
                default:
                    sessionManager.sendError(session, "unknown_message_type", "tipo desconocido: " + type,
                            correlationId);
            }
        } catch (RoomException e) {
            logger.warn("⚠️ Mensaje {} rechazado: {}", type, e.getMessage());
            sessionManager.sendError(session, e, correlationId);
        } catch (Exception e) {
            logger.error("❌ Error processing message {}: {}", type, e.getMessage(), e);
            sessionManager.sendError(session, "processing_error", "error interno", correlationId);
        }
    }

    // ==================== MANEJO DE AUTENTICACIÓN ====================
    private void handleAuthentication(WebSocketSession session, SyncMsg msg) {
        String roomId = msg.getRoomId();
        String userId = msg.getSenderId();
        String correlationId = msg.getCorrelationId();

        membershipService.connect(roomId, userId, msg.getStringData("username"), msg.getStringData("avatar"), session)
                .whenComplete((state, ex) -> {
                    if (ex != null) {
                        replyFailure(session, ex, correlationId);
                        return;
                    }
                    UserSession userSession = userSessions.get(session.getId());
                    if (userSession != null) {
                        userSession.userId = userId;
                        userSession.roomId = roomId;
                    }
                    // afterConnectionClosed pudo correr mientras el auth esperaba en la cola de la sala
                    if (userSession == null || !session.isOpen() || userSessions.get(session.getId()) != userSession) {
                        logger.info("🔌 Sesión {} cerrada antes de completar el auth en sala {}", session.getId(),
                                roomId);
                        disconnectQuietly(roomId, userId, session);
                        return;
                    }
                    logger.info("🔐 Sesión autenticada y vinculada: [SessionID: {}] -> [RoomID: {}, User: {}]",
                            session.getId(), roomId, userId);
                    sessionManager.sendAck(session, true, "authenticated", correlationId);
                });
    }

    // ==================== MANEJO DE EVENTOS ESPECÍFICOS ====================

    private void handleSyncRequest(WebSocketSession session, SyncMsg msg) {
        String userId = msg.getSenderId();
        reply(session, msg, sessionManager.execute(msg.getRoomId(), room -> {
            sessionManager.sendFullRoomState(session, room, userId);
            return null;
        }));
    }

    private void handleMode(WebSocketSession session, SyncMsg msg) {
        String mode = msg.getStringData("mode");
        if (mode == null) {
            throw RoomException.validation("falta el modo");
        }
        MemberMode memberMode;
        try {
            memberMode = MemberMode.fromValue(mode);
        } catch (IllegalArgumentException e) {
            throw RoomException.validation(e.getMessage());
        }
        reply(session, msg, membershipService.setMode(msg.getRoomId(), msg.getSenderId(), memberMode));
    }

    private void handlePlaylistManagement(WebSocketSession session, SyncMsg msg) {
        String roomId = msg.getRoomId();
        String userId = msg.getSenderId();
        String subType = msg.getSubType();

        if (MessageTypes.PLAYLIST_ADD.equals(subType)) {
            reply(session, msg, playlistService.addSong(roomId, userId, toPlaylistItem(msg)));
        } else if (MessageTypes.PLAYLIST_REMOVE.equals(subType)) {
            reply(session, msg, playlistService.removeSong(roomId, userId, requireInt(msg, "position")));
        } else if (MessageTypes.PLAYLIST_REORDER.equals(subType)) {
            reply(session, msg, playlistService.reorderSong(roomId, userId, requireInt(msg, "from"),
                    requireInt(msg, "to")));
        } else {
            sessionManager.sendError(session, "unknown_subtype", "subtipo desconocido: " + subType,
                    msg.getCorrelationId());
        }
    }

    private void handlePlayback(WebSocketSession session, SyncMsg msg) {
        String roomId = msg.getRoomId();
        String userId = msg.getSenderId();
        String subType = msg.getSubType();

        if (MessageTypes.PLAYBACK_REPORT.equals(subType)) {
            PlaybackSnapshot report = msg.getData() != null
                    ? objectMapper.convertValue(msg.getData(), PlaybackSnapshot.class)
                    : null;
            reply(session, msg, playbackService.reportPlayback(roomId, userId, report));
        } else if (MessageTypes.PLAYBACK_REQUEST.equals(subType)) {
            reply(session, msg, playbackService.requestPlayback(roomId, userId));
        } else if (MessageTypes.PLAYBACK_CONTROL.equals(subType)) {
            reply(session, msg, playbackService.controlPlayback(roomId, userId, msg.getStringData("command"),
                    msg.getDoubleData("positionSeconds"), msg.getIntData("songPosition")));
        } else {
            sessionManager.sendError(session, "unknown_subtype", "subtipo desconocido: " + subType,
                    msg.getCorrelationId());
        }
    }

    private void handleMemberManagement(WebSocketSession session, SyncMsg msg) {
        String roomId = msg.getRoomId();
        String userId = msg.getSenderId();
        String subType = msg.getSubType();
        String targetId = msg.getStringData("userId");

        if (MessageTypes.MEMBER_GRANT_CONTROL.equals(subType)) {
            reply(session, msg, membershipService.grantControl(roomId, userId, targetId,
                    msg.getBoolData("canControl", true)));
        } else if (MessageTypes.MEMBER_TRANSFER_OWNER.equals(subType)) {
            reply(session, msg, membershipService.transferOwner(roomId, userId, targetId));
        } else {
            sessionManager.sendError(session, "unknown_subtype", "subtipo desconocido: " + subType,
                    msg.getCorrelationId());
        }
    }

    private void handleChat(WebSocketSession session, SyncMsg msg) {
        reply(session, msg, chatService.sendMessage(msg.getRoomId(), msg.getSenderId(),
                msg.getStringData("content"), msg.getStringData("clientMessageId")));
    }

    private void handleRoomLifecycle(WebSocketSession session, SyncMsg msg) {
        String subType = msg.getSubType();
        if (MessageTypes.ROOM_LEAVE.equals(subType)) {
            reply(session, msg, membershipService.leave(msg.getRoomId(), msg.getSenderId()));
        } else if (MessageTypes.ROOM_DISBAND.equals(subType)) {
            reply(session, msg, membershipService.disband(msg.getRoomId(), msg.getSenderId()));
        } else {
            sessionManager.sendError(session, "unknown_subtype", "subtipo desconocido: " + subType,
                    msg.getCorrelationId());
        }
    }

    // ==================== RESPUESTAS ====================

    private void reply(WebSocketSession session, SyncMsg msg, CompletableFuture<?> result) {
        String correlationId = msg.getCorrelationId();
        result.whenComplete((ignored, ex) -> {
            if (ex == null) {
                sessionManager.sendAck(session, true, "success", correlationId);
            } else {
                replyFailure(session, ex, correlationId);
            }
        });
    }

    private void replyFailure(WebSocketSession session, Throwable ex, String correlationId) {
        Throwable cause = unwrap(ex);
        if (cause instanceof RoomException) {
            sessionManager.sendError(session, (RoomException) cause, correlationId);
        } else {
            logger.error("❌ Error inesperado procesando mensaje: {}", cause.getMessage(), cause);
            sessionManager.sendError(session, "processing_error", "error interno", correlationId);
        }
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    // ==================== CONVERSIÓN DE PAYLOADS ====================

    private PlaylistItem toPlaylistItem(SyncMsg msg) {
        Map<String, Object> data = msg.getDataAsMap();
        if (data == null) {
            throw RoomException.validation("faltan los datos de la canción");
        }
        SongSource source = null;
        String sourceValue = msg.getStringData("source");
        if (sourceValue != null) {
            try {
                source = SongSource.fromValue(sourceValue);
            } catch (IllegalArgumentException e) {
                throw RoomException.validation(e.getMessage());
            }
        }
        Integer duration = msg.getIntData("duration");
        return new PlaylistItem(
                msg.getStringData("songId"),
                msg.getStringData("name"),
                msg.getStringData("artist"),
                msg.getStringData("cover"),
                duration != null ? duration : 0,
                source,
                0,
                msg.getSenderId(),
                0L);
    }

    private static int requireInt(SyncMsg msg, String key) {
        Integer value = msg.getIntData(key);
        if (value == null) {
            throw RoomException.validation("falta el campo numérico '" + key + "'");
        }
        return value;
    }

    // ==================== SESIONES ====================

    private static class UserSession {
        final WebSocketSession session;
        volatile String roomId;
        volatile String userId;
        volatile long lastActivity;

        UserSession(WebSocketSession session) {
            this.session = session;
            this.lastActivity = System.currentTimeMillis();
        }

        void updateActivity() {
            this.lastActivity = System.currentTimeMillis();
        }
    }

    /**
     * La sesión debe estar autenticada en la misma sala y con el mismo usuario del mensaje
     */
    private boolean validateSession(UserSession userSession, SyncMsg msg) {
        if (userSession == null) {
            logger.warn("❌ Invalid session: UserSession is null for sender {}", msg.getSenderId());
            return false;
        }
        if (userSession.roomId == null || userSession.userId == null) {
            logger.warn("❌ Invalid session: not authenticated ({})", userSession.session.getId());
            return false;
        }
        if (!userSession.roomId.equals(msg.getRoomId())) {
            logger.warn("❌ Invalid session: Mismatch roomId. Session: {} vs Msg: {}", userSession.roomId,
                    msg.getRoomId());
            return false;
        }
        if (!userSession.userId.equals(msg.getSenderId())) {
            logger.warn("❌ Invalid session: Mismatch senderId. Session: {} vs Msg: {}", userSession.userId,
                    msg.getSenderId());
            return false;
        }
        return true;
    }

    // ==================== LIMPIEZA DE SESIONES INACTIVAS ====================

    private void startSweeper() {
        sweeper.scheduleAtFixedRate(this::cleanupInactiveSessions,
                properties.getSweepIntervalMs(), properties.getSweepIntervalMs(), TimeUnit.MILLISECONDS);
        logger.info("🧹 Sweeper iniciado (timeout={}ms)", properties.getClientTimeoutMs());
    }

    private void cleanupInactiveSessions() {
        long now = System.currentTimeMillis();
        userSessions.values().forEach(userSession -> {
            if (now - userSession.lastActivity > properties.getClientTimeoutMs()) {
                logger.info("🧹 Cerrando sesión inactiva {} (sala {})", userSession.session.getId(),
                        userSession.roomId);
                // afterConnectionClosed se encarga de la desconexión en la sala
                sessionManager.closeConnection(userSession.session, CloseStatus.SESSION_NOT_RELIABLE);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        sweeper.shutdownNow();
    }
}

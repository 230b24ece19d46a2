package com.rebenew.listenParty.syncserver.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberRole;
import com.rebenew.listenParty.syncserver.config.RoomProperties;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomSession;
import com.rebenew.listenParty.syncserver.model.UserRoomInfo;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;
import java.util.regex.Pattern;

// Registro de salas y canal de difusión. RoomSession es la fuente única de verdad.

@Service
public class RoomSessionManager {
    private static final Logger logger = LoggerFactory.getLogger(RoomSessionManager.class);

    private static final Pattern ROOM_ID_PATTERN = Pattern.compile("^\\d{6}$");
    private static final int MAX_ID_ATTEMPTS = 100;

    // ============================
    // ESTADO PRINCIPAL
    // ============================
    private final ConcurrentHashMap<String, RoomSession> sessions = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final RoomProperties properties;
    private final Clock clock;

    public RoomSessionManager(ObjectMapper objectMapper, RoomProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        logger.info("RoomSessionManager inicializado (maxMembers={}, ownerDisconnectPolicy={})",
                properties.getMaxMembers(), properties.getOwnerDisconnectPolicy());
    }

    // ====================
    // CREACIÓN DE SALAS
    // ====================
    public RoomSession createRoom(String ownerId, String ownerName, String avatar, String roomName) {
        validateUserId(ownerId);
        if (roomName == null || roomName.trim().isEmpty()) {
            throw RoomException.validation("el nombre de la sala es obligatorio");
        }

        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String roomId = String.format("%06d", ThreadLocalRandom.current().nextInt(900000) + 100000);
            if (sessions.containsKey(roomId))
                continue;

            RoomSession session = new RoomSession(roomId, roomName.trim(), ownerId, ownerName,
                    properties.getMaxMembers(), clock.instant());
            Member owner = new Member(ownerId, ownerName, avatar, MemberRole.OWNER, clock.millis(),
                    session.nextJoinOrder());
            session.addMember(owner);

            if (sessions.putIfAbsent(roomId, session) != null) {
                session.shutdownQueue();
                continue;
            }
            logger.info("🎵 Sala creada: {} ('{}') por owner: {}", roomId, session.getName(), ownerId);
            return session;
        }
        throw new IllegalStateException("No se pudo generar un roomId libre tras " + MAX_ID_ATTEMPTS + " intentos");
    }

    // ====================
    // GESTIÓN BÁSICA
    // ====================

    public RoomSession getSession(String roomId) {
        return roomId != null ? sessions.get(roomId) : null;
    }

    public RoomSession requireSession(String roomId) {
        validateRoomId(roomId);
        RoomSession session = sessions.get(roomId);
        if (session == null || !session.isActive()) {
            throw RoomException.roomNotFound(roomId);
        }
        return session;
    }

    public boolean roomExists(String roomId) {
        RoomSession session = getSession(roomId);
        return session != null && session.isActive();
    }

    /**
     * Ejecuta la operación en la cola de la sala. Las operaciones sobre una misma
     * sala se aplican una a una, en orden de llegada.
     */
    public <T> CompletableFuture<T> execute(String roomId, Function<RoomSession, T> operation) {
        RoomSession session;
        try {
            session = requireSession(roomId);
        } catch (RoomException e) {
            return CompletableFuture.failedFuture(e);
        }
        return session.submit(() -> {
            if (!session.isActive()) {
                throw RoomException.roomNotFound(roomId);
            }
            try {
                return operation.apply(session);
            } catch (RoomException e) {
                logger.warn("⚠️ Operación rechazada en sala {}: {}", roomId, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                logger.error("💥 Error inesperado en la cola de la sala {}: {}", roomId, e.getMessage(), e);
                throw e;
            }
        });
    }

    // Quita la sala del registro; se llama desde su propia cola al disolverla
    public void removeRoom(RoomSession session) {
        session.markDisbanded();
        closeAllConnections(session);
        sessions.remove(session.getRoomId(), session);
        session.shutdownQueue();
        logger.info("🗑️ Sala eliminada del registro: {}", session.getRoomId());
    }

    // Salas donde el usuario es miembro, la más reciente primero
    public List<UserRoomInfo> findRoomsForUser(String userId) {
        List<RoomSession> rooms = new ArrayList<>();
        for (RoomSession session : sessions.values()) {
            if (session.isActive() && session.isMember(userId)) {
                rooms.add(session);
            }
        }
        rooms.sort(Comparator.comparing(RoomSession::getCreatedAt).reversed());
        List<UserRoomInfo> result = new ArrayList<>(rooms.size());
        for (RoomSession room : rooms) {
            result.add(room.toUserRoomInfo(userId));
        }
        return result;
    }

    // ==================== UTILIDADES DE BROADCAST ====================

    public void broadcastMemberList(RoomSession room) {
        Map<String, Object> data = new HashMap<>();
        data.put("members", room.getMemberViews());
        Member master = room.getMaster();
        data.put("masterId", master != null ? master.getUserId() : null);
        broadcastToRoom(room, SyncMsg.of(MessageTypes.MEMBER_LIST, null, room.getRoomId(), data), null);
        logger.debug("👥 Member list broadcast in room: {} ({} members)", room.getRoomId(), room.getMemberCount());
    }

    public void broadcastPlaylist(RoomSession room) {
        Map<String, Object> data = Map.of("items", room.getPlaylist().getItems());
        broadcastToRoom(room, SyncMsg.of(MessageTypes.PLAYLIST, MessageTypes.PLAYLIST_UPDATE, room.getRoomId(), data),
                null);
        logger.debug("📝 Playlist broadcast in room: {} ({} items)", room.getRoomId(), room.getPlaylist().size());
    }

    public void broadcastMasterMode(RoomSession room) {
        Member master = room.getMaster();
        Map<String, Object> data = new HashMap<>();
        data.put("active", master != null);
        data.put("masterId", master != null ? master.getUserId() : null);
        data.put("masterName", master != null ? master.getUsername() : null);
        broadcastToRoom(room, SyncMsg.of(MessageTypes.MODE, MessageTypes.MODE_MASTER_MODE, room.getRoomId(), data),
                null);
        logger.debug("🎧 Master mode broadcast in room: {} (active={})", room.getRoomId(), master != null);
    }

    // Broadcast un mensaje a todos los miembros conectados de una sala
    public void broadcastToRoom(RoomSession room, SyncMsg message, String excludeUserId) {
        if (room == null)
            return;

        String json = serialize(message, room.getRoomId());
        if (json == null)
            return;

        room.getConnections().forEach((targetUserId, session) -> {
            if (excludeUserId != null && excludeUserId.equals(targetUserId))
                return;
            safeSend(session, json);
        });
    }

    // Envía un mensaje a un único miembro, si está conectado
    public boolean sendToMember(RoomSession room, String userId, SyncMsg message) {
        WebSocketSession session = room.getConnection(userId);
        if (session == null || !session.isOpen()) {
            logger.debug("Miembro {} sin conexión en sala {}, mensaje {} descartado", userId, room.getRoomId(),
                    message.getType());
            return false;
        }
        String json = serialize(message, room.getRoomId());
        return json != null && safeSend(session, json);
    }

    // Envío seguro de mensajes WebSocket
    public boolean safeSend(WebSocketSession session, String json) {
        if (session == null)
            return false;
        try {
            if (!session.isOpen())
                return false;
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
            return true;
        } catch (IOException | IllegalStateException e) {
            logger.warn("⚠️ Error enviando mensaje WebSocket a sesión {}: {}", session.getId(), e.getMessage());
            return false;
        }
    }

    public void send(WebSocketSession session, SyncMsg message) {
        String json = serialize(message, message.getRoomId());
        if (json != null)
            safeSend(session, json);
    }

    // Enviar mensaje ACK de confirmación
    public void sendAck(WebSocketSession session, boolean success, String reason, String correlationId) {
        send(session, SyncMsg.ack(success, reason, correlationId));
    }

    // Notificar error a un usuario específico
    public void sendError(WebSocketSession session, RoomException error, String correlationId) {
        send(session, SyncMsg.error(error.getCode(), error.getMessage(), correlationId));
    }

    public void sendError(WebSocketSession session, String errorCode, String message, String correlationId) {
        send(session, SyncMsg.error(errorCode, message, correlationId));
    }

    // Enviar estado completo de la sala a un usuario específico
    public void sendFullRoomState(WebSocketSession session, RoomSession room, String userId) {
        if (session == null || room == null)
            return;
        send(session, SyncMsg.of(MessageTypes.FULL_STATE, null, room.getRoomId(), room.toStateResponse(userId)));
        logger.debug("📦 Sent full state to {} in room: {}", userId, room.getRoomId());
    }

    public void closeConnection(WebSocketSession session, CloseStatus status) {
        if (session == null)
            return;
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            logger.debug("Error cerrando sesión {}: {}", session.getId(), e.getMessage());
        }
    }

    // Cierra todas las conexiones WebSocket de una sala
    private void closeAllConnections(RoomSession room) {
        room.getConnections().values().forEach(session -> closeConnection(session, CloseStatus.NORMAL));
        room.getConnections().clear();
    }

    private String serialize(SyncMsg message, String roomId) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (Exception e) {
            logger.error("❌ Error serializando mensaje para sala {}: {}", roomId, e.getMessage(), e);
            return null;
        }
    }

    // ==================== VALIDACIONES ====================

    public void validateRoomId(String roomId) {
        if (roomId == null || !ROOM_ID_PATTERN.matcher(roomId).matches()) {
            throw RoomException.validation("roomId debe tener 6 dígitos: " + roomId);
        }
    }

    private void validateUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw RoomException.validation("userId no puede ser nulo o vacío");
        }
    }

    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down RoomSessionManager ({} rooms)...", sessions.size());
        sessions.values().forEach(RoomSession::shutdownQueue);
        sessions.clear();
    }
}

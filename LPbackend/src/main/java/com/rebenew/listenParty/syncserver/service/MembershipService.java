package com.rebenew.listenParty.syncserver.service;

import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.MemberRole;
import com.rebenew.listenParty.protocol.model.MemberView;
import com.rebenew.listenParty.syncserver.config.RoomProperties;
import com.rebenew.listenParty.syncserver.core.PermissionGate;
import com.rebenew.listenParty.syncserver.core.RoomSessionManager;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomOperation;
import com.rebenew.listenParty.syncserver.model.RoomResponse;
import com.rebenew.listenParty.syncserver.model.RoomSession;
import com.rebenew.listenParty.syncserver.model.RoomStateResponse;
import com.rebenew.listenParty.syncserver.model.UserRoomInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Ciclo de vida de los miembros: entrada, salida, modo listen/chat, permisos de control,
 * transferencia de propiedad y conexión/desconexión del canal.
 */
@Service
public class MembershipService {
    private static final Logger logger = LoggerFactory.getLogger(MembershipService.class);

    private final RoomSessionManager roomSessionManager;
    private final PlaybackService playbackService;
    private final ChatService chatService;
    private final RoomProperties properties;
    private final Clock clock;

    public MembershipService(RoomSessionManager roomSessionManager, PlaybackService playbackService,
            ChatService chatService, RoomProperties properties, Clock clock) {
        this.roomSessionManager = roomSessionManager;
        this.playbackService = playbackService;
        this.chatService = chatService;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== SALAS ====================

    public RoomResponse createRoom(String userId, String username, String avatar, String roomName) {
        RoomSession room = roomSessionManager.createRoom(userId, username, avatar, roomName);
        return room.toRoomResponse();
    }

    public List<UserRoomInfo> getMyRooms(String userId) {
        return roomSessionManager.findRoomsForUser(userId);
    }

    public CompletableFuture<RoomStateResponse> getRoomState(String roomId, String userId) {
        return roomSessionManager.execute(roomId, room -> {
            room.requireMember(userId);
            return room.toStateResponse(userId);
        });
    }

    public CompletableFuture<Void> disband(String roomId, String userId) {
        return roomSessionManager.execute(roomId, room -> {
            PermissionGate.check(room.getMember(userId), RoomOperation.DISBAND);

            roomSessionManager.broadcastToRoom(room,
                    SyncMsg.of(MessageTypes.ROOM, MessageTypes.ROOM_DISBAND, roomId, Map.of("by", userId)), null);
            roomSessionManager.removeRoom(room);
            logger.info("💥 Sala {} disuelta por {}", roomId, userId);
            return null;
        });
    }

    // ==================== ENTRADA / SALIDA ====================

    public CompletableFuture<RoomStateResponse> join(String roomId, String userId, String username, String avatar) {
        return roomSessionManager.execute(roomId, room -> {
            joinIfNeeded(room, userId, username, avatar);
            return room.toStateResponse(userId);
        });
    }

    public CompletableFuture<Void> leave(String roomId, String userId) {
        return roomSessionManager.execute(roomId, room -> {
            Member member = room.removeMember(userId);
            if (member == null) {
                logger.warn("Usuario {} intentó salir de la sala {} sin ser miembro", userId, roomId);
                return null;
            }
            WebSocketSession connection = room.removeConnection(userId);
            roomSessionManager.closeConnection(connection, CloseStatus.NORMAL);

            // salir no transfiere la propiedad: los seguidores se quedan con el último snapshot
            Map<String, Object> data = new HashMap<>();
            data.put("userId", userId);
            data.put("username", member.getUsername());
            roomSessionManager.broadcastToRoom(room,
                    SyncMsg.of(MessageTypes.MEMBER, MessageTypes.MEMBER_LEAVE, roomId, data), null);
            roomSessionManager.broadcastMemberList(room);
            chatService.appendSystemMessage(room, member.getUsername() + " salió de la sala");
            logger.info("👋 Usuario {} salió de la sala {}", userId, roomId);
            return null;
        });
    }

    // ==================== CONEXIÓN DEL CANAL ====================

    /**
     * Vincula la sesión WebSocket del usuario (uniéndolo si aún no es miembro)
     * y le envía el estado completo.
     */
    public CompletableFuture<RoomStateResponse> connect(String roomId, String userId, String username, String avatar,
            WebSocketSession connection) {
        return roomSessionManager.execute(roomId, room -> {
            Member member = joinIfNeeded(room, userId, username, avatar);

            WebSocketSession previous = room.attachConnection(userId, connection);
            if (previous != null && previous != connection) {
                logger.info("🔁 Usuario {} reemplaza su conexión anterior en sala {}", userId, roomId);
                roomSessionManager.closeConnection(previous, CloseStatus.NORMAL);
            }
            member.setOnline(true);

            roomSessionManager.sendFullRoomState(connection, room, userId);
            roomSessionManager.broadcastMemberList(room);
            if (PermissionGate.isMaster(member)) {
                // el master vuelve: los seguidores recibirán su próximo reporte
                roomSessionManager.broadcastMasterMode(room);
            }
            logger.info("🔌 Usuario {} conectado a sala {}", userId, roomId);
            return room.toStateResponse(userId);
        });
    }

    public CompletableFuture<Void> disconnect(String roomId, String userId, WebSocketSession connection) {
        return roomSessionManager.execute(roomId, room -> {
            if (!room.detachConnection(userId, connection)) {
                logger.debug("Desconexión obsoleta de {} en sala {}, ignorada", userId, roomId);
                return null;
            }
            Member member = room.getMember(userId);
            if (member == null)
                return null;
            member.setOnline(false);

            roomSessionManager.broadcastToRoom(room,
                    SyncMsg.of(MessageTypes.MEMBER, MessageTypes.MEMBER_OFFLINE, roomId, Map.of("userId", userId)),
                    null);

            if (member.isOwner()) {
                handleOwnerDisconnect(room, member);
            }
            roomSessionManager.broadcastMemberList(room);
            logger.info("🔌 Usuario {} desconectado de sala {}", userId, roomId);
            return null;
        });
    }

    private void handleOwnerDisconnect(RoomSession room, Member owner) {
        if (properties.getOwnerDisconnectPolicy() == RoomProperties.OwnerDisconnectPolicy.FREEZE) {
            logger.warn("👑 Owner {} desconectado de sala {}: seguidores congelados en el último snapshot",
                    owner.getUserId(), room.getRoomId());
            return;
        }
        Member successor = null;
        for (Member candidate : room.getMembers()) {
            if (!candidate.getUserId().equals(owner.getUserId()) && candidate.isOnline()) {
                successor = candidate;
                break;
            }
        }
        if (successor == null) {
            logger.warn("👑 Owner {} desconectado de sala {} sin sucesor conectado", owner.getUserId(),
                    room.getRoomId());
            return;
        }
        logger.warn("👑 Owner {} desconectado de sala {}: propiedad transferida a {}", owner.getUserId(),
                room.getRoomId(), successor.getUserId());
        applyTransfer(room, owner, successor);
    }

    // ==================== MODO ====================

    public CompletableFuture<MemberView> setMode(String roomId, String userId, MemberMode mode) {
        return roomSessionManager.execute(roomId, room -> {
            Member member = room.requireMember(userId);
            PermissionGate.check(member, RoomOperation.SET_MODE);
            if (mode == null) {
                throw RoomException.validation("modo requerido");
            }
            if (member.getMode() == mode) {
                return member.toView();
            }

            MemberMode previous = member.getMode();
            member.setMode(mode);
            broadcastModeChange(room, member);

            if (member.isOwner()) {
                if (mode == MemberMode.LISTEN) {
                    logger.info("🎧 Owner {} es ahora master en sala {}", userId, roomId);
                } else if (previous == MemberMode.LISTEN) {
                    int forced = forceFollowersToChat(room, member);
                    logger.info("🎧 Owner {} dejó de ser master en sala {} ({} seguidores pasan a chat)", userId,
                            roomId, forced);
                }
                roomSessionManager.broadcastMasterMode(room);
            } else if (mode == MemberMode.LISTEN) {
                // si hay master activo se le pide un reporte para el nuevo seguidor
                if (room.getActiveMaster() != null) {
                    playbackService.requestPlayback(room, member);
                }
            }

            roomSessionManager.broadcastMemberList(room);
            return member.toView();
        });
    }

    private int forceFollowersToChat(RoomSession room, Member owner) {
        int forced = 0;
        for (Member other : room.getMembers()) {
            if (other != owner && other.isListening()) {
                other.setMode(MemberMode.CHAT);
                broadcastModeChange(room, other);
                forced++;
            }
        }
        return forced;
    }

    private void broadcastModeChange(RoomSession room, Member member) {
        Map<String, Object> data = new HashMap<>();
        data.put("userId", member.getUserId());
        data.put("mode", member.getMode());
        roomSessionManager.broadcastToRoom(room,
                SyncMsg.of(MessageTypes.MODE, MessageTypes.MODE_SET, room.getRoomId(), data), null);
    }

    // ==================== PERMISOS Y PROPIEDAD ====================

    public CompletableFuture<MemberView> grantControl(String roomId, String actorId, String targetId,
            boolean canControl) {
        return roomSessionManager.execute(roomId, room -> {
            Member actor = room.getMember(actorId);
            PermissionGate.check(actor, RoomOperation.GRANT_CONTROL);
            Member target = room.getMember(targetId);
            if (target == null) {
                throw RoomException.validation("el usuario " + targetId + " no es miembro");
            }
            if (!PermissionGate.canGrantControlTo(actor, target)) {
                throw RoomException.permissionDenied("no se puede cambiar el control del owner");
            }

            target.setCanControl(canControl);
            Map<String, Object> data = new HashMap<>();
            data.put("userId", targetId);
            data.put("canControl", canControl);
            roomSessionManager.broadcastToRoom(room,
                    SyncMsg.of(MessageTypes.MEMBER, MessageTypes.MEMBER_GRANT_CONTROL, roomId, data), null);
            roomSessionManager.broadcastMemberList(room);
            logger.info("🎛️ Control {} para {} en sala {} por {}", canControl ? "concedido" : "retirado",
                    targetId, roomId, actorId);
            return target.toView();
        });
    }

    public CompletableFuture<Void> transferOwner(String roomId, String actorId, String targetId) {
        return roomSessionManager.execute(roomId, room -> {
            Member actor = room.getMember(actorId);
            PermissionGate.check(actor, RoomOperation.TRANSFER_OWNER);
            Member target = room.getMember(targetId);
            if (target == null) {
                throw RoomException.validation("el usuario " + targetId + " no es miembro");
            }
            if (!PermissionGate.canTransferOwnerTo(actor, target)) {
                throw RoomException.validation("el owner no puede transferirse la sala a sí mismo");
            }

            applyTransfer(room, actor, target);
            roomSessionManager.broadcastMemberList(room);
            logger.info("👑 Propiedad de sala {} transferida de {} a {}", roomId, actorId, targetId);
            return null;
        });
    }

    private void applyTransfer(RoomSession room, Member from, Member to) {
        boolean hadMaster = room.getMaster() != null;

        from.setRole(MemberRole.MEMBER);
        from.setCanControl(false);
        to.setRole(MemberRole.OWNER);
        to.setCanControl(true);
        room.setOwner(to.getUserId(), to.getUsername());

        broadcastRoleUpdate(room, from);
        broadcastRoleUpdate(room, to);
        if (hadMaster && room.getMaster() == null) {
            // el nuevo owner está en chat: sin master, nadie se queda escuchando
            int forced = forceFollowersToChat(room, to);
            logger.info("🎧 Sala {} sin master tras la transferencia ({} oyentes pasan a chat)", room.getRoomId(),
                    forced);
        }
        if (hadMaster || room.getMaster() != null) {
            roomSessionManager.broadcastMasterMode(room);
        }
    }

    private void broadcastRoleUpdate(RoomSession room, Member member) {
        Map<String, Object> data = new HashMap<>();
        data.put("userId", member.getUserId());
        data.put("role", member.getRole());
        data.put("canControl", member.isCanControl());
        roomSessionManager.broadcastToRoom(room,
                SyncMsg.of(MessageTypes.MEMBER, MessageTypes.MEMBER_ROLE_UPDATE, room.getRoomId(), data), null);
    }

    // ==================== UTILIDADES ====================

    private Member joinIfNeeded(RoomSession room, String userId, String username, String avatar) {
        if (userId == null || userId.isBlank()) {
            throw RoomException.validation("userId requerido");
        }
        Member existing = room.getMember(userId);
        if (existing != null) {
            if (username != null && !username.isBlank())
                existing.setUsername(username);
            if (avatar != null)
                existing.setAvatar(avatar);
            return existing;
        }
        if (room.isFull()) {
            throw RoomException.validation("la sala está llena (" + room.getMaxMembers() + " miembros)");
        }

        MemberRole role = room.isOwner(userId) ? MemberRole.OWNER : MemberRole.MEMBER;
        String name = username != null && !username.isBlank() ? username : userId;
        Member member = room.addMember(new Member(userId, name, avatar, role, clock.millis(), room.nextJoinOrder()));

        roomSessionManager.broadcastToRoom(room,
                SyncMsg.of(MessageTypes.MEMBER, MessageTypes.MEMBER_JOIN, room.getRoomId(), member.toView()), userId);
        roomSessionManager.broadcastMemberList(room);
        chatService.appendSystemMessage(room, name + " se unió a la sala");
        logger.info("👤 Usuario {} unido a sala {} como {}", userId, room.getRoomId(), role.getValue());
        return member;
    }
}

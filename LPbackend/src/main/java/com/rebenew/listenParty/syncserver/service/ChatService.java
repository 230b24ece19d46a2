package com.rebenew.listenParty.syncserver.service;

import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.ChatMessageType;
import com.rebenew.listenParty.protocol.model.ChatMessageView;
import com.rebenew.listenParty.syncserver.config.RoomProperties;
import com.rebenew.listenParty.syncserver.core.RoomSessionManager;
import com.rebenew.listenParty.syncserver.model.ChatMessageEntity;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.model.RoomSession;
import com.rebenew.listenParty.syncserver.repository.ChatMessageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@Service
public class ChatService {
    private static final Logger logger = LoggerFactory.getLogger(ChatService.class);

    private final RoomSessionManager roomSessionManager;
    private final ChatMessageRepository chatMessageRepository;
    private final RoomProperties properties;
    private final Clock clock;

    public ChatService(RoomSessionManager roomSessionManager, ChatMessageRepository chatMessageRepository,
            RoomProperties properties, Clock clock) {
        if (properties.getMaxMessageLength() > ChatMessageEntity.MAX_CONTENT_LENGTH) {
            throw new IllegalStateException("listen-party.room.max-message-length (" + properties.getMaxMessageLength()
                    + ") supera la columna content (" + ChatMessageEntity.MAX_CONTENT_LENGTH + ")");
        }
        this.roomSessionManager = roomSessionManager;
        this.chatMessageRepository = chatMessageRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public CompletableFuture<ChatMessageView> sendMessage(String roomId, String userId, String content,
            String clientMessageId) {
        return roomSessionManager.execute(roomId, room -> {
            Member member = room.requireMember(userId);
            String text = content != null ? content.trim() : "";
            if (text.isEmpty()) {
                throw RoomException.validation("el mensaje está vacío");
            }
            if (text.length() > properties.getMaxMessageLength()) {
                throw RoomException.validation("el mensaje supera " + properties.getMaxMessageLength() + " caracteres");
            }

            ChatMessageView message = persist(room, member.getUserId(), member.getUsername(), text,
                    ChatMessageType.CHAT, clientMessageId);
            broadcast(room, message);
            logger.debug("💬 Message {} in room {} by {}", message.getId(), roomId, userId);
            return message;
        });
    }

    /**
     * Mensaje de sistema (entradas y salidas). Debe llamarse desde la cola de la sala.
     */
    public ChatMessageView appendSystemMessage(RoomSession room, String content) {
        ChatMessageView message = persist(room, "system", "system", content, ChatMessageType.SYSTEM, null);
        broadcast(room, message);
        return message;
    }

    /**
     * Últimos mensajes de la sala en orden ascendente de id.
     * El límite se ajusta a 1..historyMaxLimit; null usa historyDefaultLimit. Solo para miembros.
     */
    public List<ChatMessageView> getHistory(String roomId, String userId, Integer limit) {
        roomSessionManager.requireSession(roomId).requireMember(userId);
        int effectiveLimit = clampLimit(limit);

        List<ChatMessageEntity> latest = chatMessageRepository.findByRoomIdOrderByIdDesc(roomId,
                PageRequest.of(0, effectiveLimit));
        List<ChatMessageView> history = new ArrayList<>(latest.size());
        for (ChatMessageEntity entity : latest) {
            history.add(entity.toView());
        }
        Collections.reverse(history);
        return history;
    }

    int clampLimit(Integer limit) {
        if (limit == null)
            return properties.getHistoryDefaultLimit();
        return Math.max(1, Math.min(limit, properties.getHistoryMaxLimit()));
    }

    private ChatMessageView persist(RoomSession room, String userId, String username, String content,
            ChatMessageType type, String clientMessageId) {
        ChatMessageEntity entity = new ChatMessageEntity();
        entity.setRoomId(room.getRoomId());
        entity.setUserId(userId);
        entity.setUsername(username);
        entity.setContent(content);
        entity.setMessageType(type);
        entity.setClientMessageId(clientMessageId);
        entity.setCreatedAt(clock.instant());
        return chatMessageRepository.save(entity).toView();
    }

    private void broadcast(RoomSession room, ChatMessageView message) {
        roomSessionManager.broadcastToRoom(room,
                SyncMsg.of(MessageTypes.CHAT, message.getMessageType().getValue(), room.getRoomId(), message), null);
    }
}

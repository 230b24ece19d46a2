package com.rebenew.listenParty.syncclient.chat;

import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.ChatMessageType;
import com.rebenew.listenParty.protocol.model.ChatMessageView;
import com.rebenew.listenParty.syncclient.transport.RoomTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Flujo de chat de la sala en el cliente.
 * <p>
 * Los mensajes propios se muestran al instante con un id provisional negativo y se
 * sustituyen por el confirmado cuando el servidor lo difunde (mismo clientMessageId).
 * Los confirmados se deduplican por id y se ordenan por id y luego por timestamp.
 */
public class RoomChatFeed {
    private static final Logger logger = LoggerFactory.getLogger(RoomChatFeed.class);

    static final Comparator<ChatMessageView> CONFIRMED_ORDER = Comparator
            .comparing(ChatMessageView::getId)
            .thenComparingLong(ChatMessageView::getCreatedAt);

    private final String roomId;
    private final String userId;
    private final String username;
    private final RoomTransport transport;
    private final ChatHistorySource historySource;
    private final Clock clock;

    private final Map<Long, ChatMessageView> confirmed = new HashMap<>();
    // clientMessageId -> eco local pendiente de confirmación
    private final Map<String, ChatMessageView> pending = new LinkedHashMap<>();
    private long nextProvisionalId = -1;

    public RoomChatFeed(String roomId, String userId, String username, RoomTransport transport,
            ChatHistorySource historySource, Clock clock) {
        this.roomId = roomId;
        this.userId = userId;
        this.username = username;
        this.transport = transport;
        this.historySource = historySource;
        this.clock = clock;
    }

    /**
     * Envía un mensaje y devuelve su eco provisional.
     *
     * @throws RoomException NOT_CONNECTED si el canal está caído, VALIDATION_ERROR si está vacío
     */
    public synchronized ChatMessageView send(String content) {
        if (!transport.isConnected()) {
            throw new RoomException(ErrorCode.NOT_CONNECTED);
        }
        String text = content != null ? content.trim() : "";
        if (text.isEmpty()) {
            throw RoomException.validation("el mensaje está vacío");
        }

        String clientMessageId = UUID.randomUUID().toString();
        ChatMessageView provisional = ChatMessageView.builder()
                .id(nextProvisionalId--)
                .roomId(roomId)
                .userId(userId)
                .username(username)
                .content(text)
                .createdAt(clock.millis())
                .messageType(ChatMessageType.CHAT)
                .clientMessageId(clientMessageId)
                .build();
        pending.put(clientMessageId, provisional);

        Map<String, Object> data = new HashMap<>();
        data.put("content", text);
        data.put("clientMessageId", clientMessageId);
        SyncMsg msg = SyncMsg.request(MessageTypes.CHAT, ChatMessageType.CHAT.getValue(), roomId, userId, data)
                .withCorrelationId(clientMessageId);
        if (!transport.send(msg)) {
            pending.remove(clientMessageId);
            throw new RoomException(ErrorCode.NOT_CONNECTED);
        }
        return provisional;
    }

    /**
     * Mensaje recibido en vivo.
     *
     * @return false si era un duplicado
     */
    public synchronized boolean onLive(ChatMessageView message) {
        if (message == null || message.getId() == null) {
            return false;
        }
        if (confirmed.containsKey(message.getId())) {
            logger.debug("Duplicate chat message {} ignored", message.getId());
            return false;
        }
        confirmPending(message);
        confirmed.put(message.getId(), message);
        return true;
    }

    /**
     * El servidor rechazó el envío: se retira el eco provisional.
     */
    public synchronized boolean onSendFailed(String clientMessageId) {
        return clientMessageId != null && pending.remove(clientMessageId) != null;
    }

    /**
     * Descarga el historial; bloquea en la red, así que no debe llamarse desde el bucle del cliente.
     * El resultado se aplica después con {@link #mergeHistory(List)}.
     */
    public List<ChatMessageView> fetchHistory(int limit) {
        List<ChatMessageView> history = historySource.fetchHistory(roomId, limit);
        logger.debug("📜 Chat history fetched for room {}: {} messages", roomId, history.size());
        return history;
    }

    public synchronized void mergeHistory(List<ChatMessageView> history) {
        for (ChatMessageView message : history) {
            if (message.getId() == null)
                continue;
            confirmPending(message);
            confirmed.putIfAbsent(message.getId(), message);
        }
    }

    /**
     * Confirmados en orden, seguidos de los ecos provisionales.
     */
    public synchronized List<ChatMessageView> getMessages() {
        List<ChatMessageView> ordered = new ArrayList<>(confirmed.values());
        ordered.sort(CONFIRMED_ORDER);
        ordered.addAll(pending.values());
        return ordered;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    private void confirmPending(ChatMessageView message) {
        if (message.getClientMessageId() != null) {
            pending.remove(message.getClientMessageId());
            return;
        }
        // sin clave: se asume que es el eco propio más antiguo con el mismo contenido
        if (userId.equals(message.getUserId())) {
            Iterator<ChatMessageView> it = pending.values().iterator();
            while (it.hasNext()) {
                if (it.next().getContent().equals(message.getContent())) {
                    it.remove();
                    return;
                }
            }
        }
    }
}

package com.rebenew.listenParty.syncclient.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listenParty.protocol.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Transporte WebSocket sobre el cliente estándar de Spring (JSR-356).
 */
public class SpringRoomTransport implements RoomTransport {
    private static final Logger logger = LoggerFactory.getLogger(SpringRoomTransport.class);

    private final WebSocketClient client;
    private final String url;
    private final ObjectMapper objectMapper;

    private volatile WebSocketSession session;

    public SpringRoomTransport(String url, ObjectMapper objectMapper) {
        this(new StandardWebSocketClient(), url, objectMapper);
    }

    public SpringRoomTransport(WebSocketClient client, String url, ObjectMapper objectMapper) {
        this.client = client;
        this.url = url;
        this.objectMapper = objectMapper;
    }

    @Override
    public void connect(Listener listener) {
        logger.info("🔄 Conectando a {}", url);
        client.execute(new Handler(listener), url).whenComplete((ws, ex) -> {
            if (ex != null) {
                logger.warn("❌ No se pudo conectar a {}: {}", url, ex.getMessage());
                listener.onClose("connect_failed: " + ex.getMessage());
            }
        });
    }

    @Override
    public boolean send(SyncMsg message) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return false;
        }
        try {
            String json = objectMapper.writeValueAsString(message);
            synchronized (current) {
                current.sendMessage(new TextMessage(json));
            }
            return true;
        } catch (JsonProcessingException e) {
            logger.error("❌ Error serializando mensaje {}: {}", message.getType(), e.getMessage());
            return false;
        } catch (IOException | IllegalStateException e) {
            logger.warn("⚠️ Error enviando mensaje {}: {}", message.getType(), e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isConnected() {
        WebSocketSession current = session;
        return current != null && current.isOpen();
    }

    @Override
    public void close() {
        WebSocketSession current = session;
        session = null;
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.debug("Error cerrando sesión: {}", e.getMessage());
            }
        }
    }

    private class Handler extends TextWebSocketHandler {
        private final Listener listener;

        Handler(Listener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(@NonNull WebSocketSession ws) {
            session = ws;
            logger.info("✅ Conectado a {} ({})", url, ws.getId());
            listener.onOpen();
        }

        @Override
        protected void handleTextMessage(@NonNull WebSocketSession ws, @NonNull TextMessage message) {
            SyncMsg msg;
            try {
                msg = objectMapper.readValue(message.getPayload(), SyncMsg.class);
            } catch (JsonProcessingException e) {
                logger.error("❌ Error parseando mensaje del servidor: {}", e.getMessage());
                return;
            }
            listener.onMessage(msg);
        }

        @Override
        public void afterConnectionClosed(@NonNull WebSocketSession ws, @NonNull CloseStatus status) {
            if (session == ws) {
                session = null;
            }
            logger.info("🔌 Conexión cerrada ({})", status);
            listener.onClose(status.toString());
        }

        @Override
        public void handleTransportError(@NonNull WebSocketSession ws, @NonNull Throwable exception) {
            logger.error("🚨 Error de transporte: {}", exception.getMessage());
        }
    }
}

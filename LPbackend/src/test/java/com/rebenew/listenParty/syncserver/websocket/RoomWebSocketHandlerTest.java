package com.rebenew.listenParty.syncserver.websocket;

import com.rebenew.listenParty.protocol.MessageTypes;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.syncserver.model.Member;
import com.rebenew.listenParty.syncserver.service.RoomServiceTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RoomWebSocketHandlerTest extends RoomServiceTestSupport {

    private RoomWebSocketHandler handler;
    private String roomId;

    @BeforeEach
    void setUpHandler() {
        handler = new RoomWebSocketHandler(manager, membershipService, playlistService, playbackService, chatService,
                objectMapper, properties);
        roomId = createRoom();
    }

    @AfterEach
    void tearDownHandler() {
        handler.shutdown();
    }

    private WebSocketSession openSocket(String userId) {
        WebSocketSession ws = mock(WebSocketSession.class);
        when(ws.getId()).thenReturn("ws-" + userId);
        when(ws.isOpen()).thenReturn(true);
        sockets.put(userId, ws);
        handler.afterConnectionEstablished(ws);
        return ws;
    }

    private void send(WebSocketSession ws, SyncMsg msg) throws Exception {
        handler.handleMessage(ws, new TextMessage(objectMapper.writeValueAsString(msg)));
    }

    // Dos vueltas por la cola: la primera deja encolado lo que disparó la operación pendiente
    private Member memberAfterQueueDrains(String userId) {
        manager.execute(roomId, room -> null).join();
        return manager.execute(roomId, room -> room.getMember(userId)).join();
    }

    @Test
    void authenticatedSocketClosingMarksMemberOffline() throws Exception {
        WebSocketSession ws = openSocket("bob");
        send(ws, SyncMsg.auth(roomId, "bob", "Bob").withCorrelationId("c1"));
        assertThat(memberAfterQueueDrains("bob").isOnline()).isTrue();
        assertThat(received("bob", MessageTypes.ACK, null))
                .anySatisfy(ack -> assertThat(ack.getCorrelationId()).isEqualTo("c1"));

        when(ws.isOpen()).thenReturn(false);
        handler.afterConnectionClosed(ws, CloseStatus.GOING_AWAY);

        assertThat(memberAfterQueueDrains("bob").isOnline()).isFalse();
    }

    @Test
    void socketClosedWhileAuthIsQueuedLeavesMemberOffline() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        manager.execute(roomId, room -> {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        });

        WebSocketSession ws = openSocket("bob");
        send(ws, SyncMsg.auth(roomId, "bob", "Bob").withCorrelationId("c1"));
        when(ws.isOpen()).thenReturn(false);
        handler.afterConnectionClosed(ws, CloseStatus.GOING_AWAY);
        gate.countDown();

        Member bob = memberAfterQueueDrains("bob");
        assertThat(bob).isNotNull();
        assertThat(bob.isOnline()).isFalse();
        WebSocketSession attached = manager.execute(roomId, room -> room.getConnection("bob")).join();
        assertThat(attached).isNull();
    }

    @Test
    void messagesBeforeAuthAreRejected() throws Exception {
        WebSocketSession ws = openSocket("bob");

        send(ws, SyncMsg.request(MessageTypes.CHAT, "chat", roomId, "bob", Map.of("content", "hola")));

        assertThat(received("bob", MessageTypes.ERROR, null))
                .singleElement()
                .satisfies(error -> assertThat(error.getStringData("code")).isEqualTo("invalid_session"));
    }
}

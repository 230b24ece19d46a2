package com.rebenew.listenParty.syncserver.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.listenParty.protocol.SyncMsg;
import com.rebenew.listenParty.protocol.error.ErrorCode;
import com.rebenew.listenParty.protocol.error.RoomException;
import com.rebenew.listenParty.protocol.model.MemberMode;
import com.rebenew.listenParty.protocol.model.PlaylistItem;
import com.rebenew.listenParty.syncserver.config.RoomProperties;
import com.rebenew.listenParty.syncserver.core.RoomSessionManager;
import com.rebenew.listenParty.syncserver.model.ChatMessageEntity;
import com.rebenew.listenParty.syncserver.repository.ChatMessageRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Servicios reales sobre un RoomSessionManager real; los WebSocket y el repositorio son mocks.
 */
public abstract class RoomServiceTestSupport {

    protected static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    protected final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    protected final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    protected final Map<String, WebSocketSession> sockets = new HashMap<>();
    protected final List<ChatMessageEntity> savedMessages = new ArrayList<>();

    protected RoomProperties properties;
    protected ChatMessageRepository chatMessageRepository;
    protected RoomSessionManager manager;
    protected ChatService chatService;
    protected PlaybackService playbackService;
    protected PlaylistService playlistService;
    protected MembershipService membershipService;

    @BeforeEach
    protected void setUpServices() {
        properties = new RoomProperties();
        chatMessageRepository = mock(ChatMessageRepository.class);
        AtomicLong ids = new AtomicLong();
        when(chatMessageRepository.save(any(ChatMessageEntity.class))).thenAnswer(invocation -> {
            ChatMessageEntity entity = invocation.getArgument(0);
            entity.setId(ids.incrementAndGet());
            savedMessages.add(entity);
            return entity;
        });

        manager = new RoomSessionManager(objectMapper, properties, clock);
        chatService = new ChatService(manager, chatMessageRepository, properties, clock);
        playbackService = new PlaybackService(manager, clock);
        playlistService = new PlaylistService(manager, clock);
        membershipService = new MembershipService(manager, playbackService, chatService, properties, clock);
    }

    @AfterEach
    protected void tearDownServices() {
        manager.shutdown();
    }

    protected String createRoom() {
        return membershipService.createRoom("owner", "Owner", null, "Sala de prueba").getId();
    }

    protected WebSocketSession connect(String roomId, String userId) {
        WebSocketSession ws = mock(WebSocketSession.class);
        when(ws.isOpen()).thenReturn(true);
        when(ws.getId()).thenReturn("ws-" + userId);
        sockets.put(userId, ws);
        membershipService.connect(roomId, userId, userId.toUpperCase(), null, ws).join();
        return ws;
    }

    protected void listen(String roomId, String userId) {
        membershipService.setMode(roomId, userId, MemberMode.LISTEN).join();
    }

    protected void grant(String roomId, String userId) {
        membershipService.grantControl(roomId, "owner", userId, true).join();
    }

    protected void clearAll() {
        sockets.values().forEach(ws -> clearInvocations(ws));
    }

    protected List<SyncMsg> received(String userId) {
        WebSocketSession ws = sockets.get(userId);
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        try {
            verify(ws, atLeast(0)).sendMessage(captor.capture());
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
        List<SyncMsg> messages = new ArrayList<>();
        for (TextMessage message : captor.getAllValues()) {
            try {
                messages.add(objectMapper.readValue(message.getPayload(), SyncMsg.class));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }
        return messages;
    }

    protected List<SyncMsg> received(String userId, String type, String subType) {
        return received(userId).stream()
                .filter(msg -> msg.is(type, subType))
                .collect(Collectors.toList());
    }

    protected static PlaylistItem song(String id) {
        return new PlaylistItem("netease_" + id, "Song " + id, "Artist " + id, null, 180, null, 0, null, 0L);
    }

    protected static ErrorCode errorOf(CompletableFuture<?> future) {
        try {
            future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RoomException) {
                return ((RoomException) e.getCause()).getErrorCode();
            }
            throw e;
        }
        throw new AssertionError("se esperaba un error");
    }
}

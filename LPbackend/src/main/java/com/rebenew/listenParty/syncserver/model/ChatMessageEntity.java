package com.rebenew.listenParty.syncserver.model;

import com.rebenew.listenParty.protocol.model.ChatMessageType;
import com.rebenew.listenParty.protocol.model.ChatMessageView;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "room_messages", indexes = @Index(name = "idx_room_messages_room", columnList = "room_id, id"))
@Getter
@Setter
@NoArgsConstructor
public class ChatMessageEntity {

    // ancho de la columna content; el máximo configurable del chat no puede superarlo
    public static final int MAX_CONTENT_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false, length = 6)
    private String roomId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    private String username;

    @Column(nullable = false, length = MAX_CONTENT_LENGTH)
    private String content;

    // CHAT o SYSTEM
    @Enumerated(EnumType.STRING)
    @Column(name = "message_type", nullable = false)
    private ChatMessageType messageType = ChatMessageType.CHAT;

    @Column(name = "client_message_id")
    private String clientMessageId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public ChatMessageView toView() {
        return ChatMessageView.builder()
                .id(id)
                .roomId(roomId)
                .userId(userId)
                .username(username)
                .content(content)
                .createdAt(createdAt != null ? createdAt.toEpochMilli() : 0L)
                .messageType(messageType)
                .clientMessageId(clientMessageId)
                .build();
    }
}

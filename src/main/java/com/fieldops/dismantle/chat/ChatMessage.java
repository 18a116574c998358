package com.fieldops.dismantle.chat;

import com.fieldops.dismantle.user.UserRole;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
@Entity
@Table(name = "chat_messages",
        indexes = {
                @Index(name = "ix_chat_message_room", columnList = "room_id"),
                @Index(name = "ix_chat_message_created", columnList = "created_at")
        })
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(nullable = false)
    private String senderUsername;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserRole senderRole;

    @Column(name = "message", nullable = false, columnDefinition = "text")
    private String body;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MessageType messageType = MessageType.TEXT;

    private String attachmentUrl;

    @Builder.Default
    @Column(name = "is_read", nullable = false)
    private boolean read = false;

    /** Assigned at persist time; the only ordering key within a room. */
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (messageType == null) messageType = MessageType.TEXT;
    }
}

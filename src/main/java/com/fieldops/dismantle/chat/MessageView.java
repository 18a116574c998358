package com.fieldops.dismantle.chat;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldops.dismantle.user.UserRole;

import java.time.LocalDateTime;

/** Wire form of a persisted message, shared by the event frame and the history query. */
public record MessageView(
        Long id,
        @JsonProperty("room_id") Long roomId,
        @JsonProperty("sender_username") String senderUsername,
        @JsonProperty("sender_role") UserRole senderRole,
        String message,
        @JsonProperty("message_type") MessageType messageType,
        @JsonProperty("attachment_url") String attachmentUrl,
        @JsonProperty("is_read") boolean read,
        @JsonProperty("created_at")
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime createdAt
) {

    public static MessageView of(ChatMessage m) {
        return new MessageView(
                m.getId(),
                m.getRoomId(),
                m.getSenderUsername(),
                m.getSenderRole(),
                m.getBody(),
                m.getMessageType(),
                m.getAttachmentUrl(),
                m.isRead(),
                m.getCreatedAt());
    }
}

package com.fieldops.dismantle.chatroom;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fieldops.dismantle.user.UserRole;

import java.time.LocalDateTime;

/** Room as seen by one caller: {@code unreadCount} is the caller's own counter. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRoomView(
        Long id,
        @JsonProperty("technician_username") String technicianUsername,
        @JsonProperty("coordinator_username") String coordinatorUsername,
        String region,
        @JsonProperty("last_message") String lastMessage,
        @JsonProperty("last_message_at")
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime lastMessageAt,
        @JsonProperty("unread_count") Integer unreadCount,
        @JsonProperty("created_at")
        @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss") LocalDateTime createdAt
) {

    public static ChatRoomView of(ChatRoom room, UserRole viewer) {
        return new ChatRoomView(
                room.getId(),
                room.getTechnicianUsername(),
                room.getCoordinatorUsername(),
                room.getRegion(),
                room.getLastMessage(),
                room.getLastMessageAt(),
                room.unreadCountFor(viewer == UserRole.TECHNICIAN ? UserRole.TECHNICIAN : UserRole.COORDINATOR),
                room.getCreatedAt());
    }

    /** Short form returned by create-or-fetch. */
    public static ChatRoomView summary(ChatRoom room) {
        return new ChatRoomView(
                room.getId(),
                room.getTechnicianUsername(),
                room.getCoordinatorUsername(),
                room.getRegion(),
                null, null, null, null);
    }
}

package com.fieldops.dismantle.chat;

import com.fieldops.dismantle.chatroom.ChatRoomRepository;
import com.fieldops.dismantle.config.ChatProperties;
import com.fieldops.dismantle.exception.BadRequestException;
import com.fieldops.dismantle.exception.NotFoundException;
import com.fieldops.dismantle.user.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persists messages and keeps the room's last-message fields and unread
 * counters in step with them. Every public method commits before returning,
 * so callers may broadcast right after.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatMessageService {

    private final ChatMessageRepository messages;
    private final ChatRoomRepository    rooms;
    private final ChatProperties        properties;
    private final Clock                 clock;

    /**
     * Stores the message and bumps the unread counter of the other side of the room.
     */
    @Transactional
    public ChatMessage send(SendMessageCommand cmd) {
        if (cmd.roomId() == null || cmd.body() == null || cmd.senderRole() == null) {
            throw new BadRequestException("room_id, message and sender_role are required");
        }
        if (!cmd.senderRole().isParticipant()) {
            throw new BadRequestException("sender_role must be technician or coordinator");
        }
        if (!rooms.existsById(cmd.roomId())) {
            throw new NotFoundException("Chat room " + cmd.roomId() + " not found");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        ChatMessage saved = messages.save(ChatMessage.builder()
                .roomId(cmd.roomId())
                .senderUsername(cmd.senderUsername())
                .senderRole(cmd.senderRole())
                .body(cmd.body())
                .messageType(cmd.messageType() == null ? MessageType.TEXT : cmd.messageType())
                .attachmentUrl(cmd.attachmentUrl())
                .createdAt(now)
                .build());

        if (cmd.senderRole() == UserRole.TECHNICIAN) {
            rooms.recordMessageFromTechnician(cmd.roomId(), cmd.body(), now);
        } else {
            rooms.recordMessageFromCoordinator(cmd.roomId(), cmd.body(), now);
        }

        log.info("💾 Message {} stored in room {} ({} as {})",
                saved.getId(), saved.getRoomId(), saved.getSenderUsername(), saved.getSenderRole().wireName());
        return saved;
    }

    /**
     * Zeroes the counter of {@code role} and flags as read every message in the
     * room that {@code reader} did not send.
     *
     * @return number of messages flipped to read
     */
    @Transactional
    public int markRead(Long roomId, UserRole role, String reader) {
        if (roomId == null || role == null) {
            throw new BadRequestException("room_id and role are required");
        }
        if (!role.isParticipant()) {
            throw new BadRequestException("role must be technician or coordinator");
        }
        if (!rooms.existsById(roomId)) {
            throw new NotFoundException("Chat room " + roomId + " not found");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (role == UserRole.TECHNICIAN) {
            rooms.resetTechnicianUnread(roomId, now);
        } else {
            rooms.resetCoordinatorUnread(roomId, now);
        }
        int flipped = messages.markReadFor(roomId, reader);

        log.info("Room {} read by {} as {} ({} messages)", roomId, reader, role.wireName(), flipped);
        return flipped;
    }

    /**
     * One page of history, oldest first. {@code skip} counts from the newest message.
     */
    @Transactional(readOnly = true)
    public List<ChatMessage> history(Long roomId, int skip, Integer limit) {
        if (skip < 0) {
            throw new BadRequestException("skip must not be negative");
        }
        int effective = limit == null ? properties.getHistory().getDefaultLimit() : limit;
        if (effective <= 0) {
            throw new BadRequestException("limit must be positive");
        }
        effective = Math.min(effective, properties.getHistory().getMaxLimit());

        List<ChatMessage> page = new ArrayList<>(messages.findPageNewestFirst(roomId, skip, effective));
        Collections.reverse(page);
        return page;
    }
}

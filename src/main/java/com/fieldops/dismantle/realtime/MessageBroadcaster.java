package com.fieldops.dismantle.realtime;

import com.fieldops.dismantle.chatroom.ChatRoom;
import com.fieldops.dismantle.chatroom.ChatRoomRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Pushes a payload to the connected members of a room. Called only after the
 * message is committed, so a missing room is logged and nothing else.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageBroadcaster {

    private final ChatRoomRepository rooms;
    private final ConnectionRegistry registry;

    public int broadcast(Long roomId, Object payload) {
        return broadcast(roomId, payload, null);
    }

    /**
     * @param excludeIdentity member to skip, or {@code null} to reach both
     * @return number of members the payload was handed to
     */
    @Transactional(readOnly = true)
    public int broadcast(Long roomId, Object payload, String excludeIdentity) {
        Optional<ChatRoom> room = rooms.findById(roomId);
        if (room.isEmpty()) {
            log.warn("Broadcast skipped, room {} not found", roomId);
            return 0;
        }

        int delivered = 0;
        for (String member : List.of(room.get().getTechnicianUsername(), room.get().getCoordinatorUsername())) {
            if (member.equals(excludeIdentity)) {
                continue;
            }
            if (registry.send(member, payload)) {
                delivered++;
            }
        }
        log.debug("Room {} broadcast reached {} member(s)", roomId, delivered);
        return delivered;
    }
}

package com.fieldops.dismantle.chatroom;

import com.fieldops.dismantle.exception.ForbiddenException;
import com.fieldops.dismantle.exception.NotFoundException;
import com.fieldops.dismantle.user.IdentityDirectory;
import com.fieldops.dismantle.user.User;
import com.fieldops.dismantle.user.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Finds or lazily creates the room pairing a technician with their coordinator,
 * and answers the room-level queries of the HTTP surface.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChatRoomService {

    private final ChatRoomRepository rooms;
    private final IdentityDirectory  directory;

    /* =======================================================================
                                 ROOM RESOLVER
       ======================================================================= */

    /**
     * Returns the room of the technician and the coordinator assigned to the
     * technician's area (or, failing that, region). Repeated calls return the
     * same room.
     *
     * @throws NotFoundException if the technician or a matching coordinator does not exist
     */
    public ChatRoom resolveOrCreate(String technicianUsername) {
        User technician = directory.findByUsernameAndRole(technicianUsername, UserRole.TECHNICIAN);
        return findOrCreate(technician, coordinatorOf(technician));
    }

    private User coordinatorOf(User technician) {
        return directory.findByAreaOrRegion(UserRole.COORDINATOR, technician.getArea(), technician.getRegion());
    }

    private ChatRoom findOrCreate(User technician, User coordinator) {
        return rooms.findByTechnicianUsernameAndCoordinatorUsername(
                        technician.getUsername(), coordinator.getUsername())
                .orElseGet(() -> create(technician, coordinator));
    }

    private ChatRoom create(User technician, User coordinator) {
        try {
            ChatRoom room = rooms.saveAndFlush(ChatRoom.builder()
                    .technicianUsername(technician.getUsername())
                    .coordinatorUsername(coordinator.getUsername())
                    .region(technician.getRegion())
                    .build());
            log.info("Created room {} ({} ↔ {}, region={})",
                    room.getId(), technician.getUsername(), coordinator.getUsername(), room.getRegion());
            return room;
        } catch (DataIntegrityViolationException race) {
            // another request created the pair first
            return rooms.findByTechnicianUsernameAndCoordinatorUsername(
                            technician.getUsername(), coordinator.getUsername())
                    .orElseThrow(() -> race);
        }
    }

    /* =======================================================================
                                 QUERY SURFACE
       ======================================================================= */

    /**
     * Technicians and coordinators may only open their own rooms; admins any.
     * Permissions are checked before anything is stored.
     */
    public ChatRoom createOrFetch(User caller, String technicianUsername) {
        if (caller.getRole() == UserRole.TECHNICIAN && !caller.getUsername().equals(technicianUsername)) {
            throw new ForbiddenException("Technicians may only open their own room");
        }
        User technician  = directory.findByUsernameAndRole(technicianUsername, UserRole.TECHNICIAN);
        User coordinator = coordinatorOf(technician);
        if (caller.getRole() == UserRole.COORDINATOR && !coordinator.getUsername().equals(caller.getUsername())) {
            throw new ForbiddenException("Technician '" + technicianUsername + "' is not assigned to you");
        }
        return findOrCreate(technician, coordinator);
    }

    public List<ChatRoomView> listRoomsFor(User caller) {
        List<ChatRoom> visible = switch (caller.getRole()) {
            case TECHNICIAN -> rooms.findAllByTechnicianUsernameOrderByIdAsc(caller.getUsername());
            case COORDINATOR -> rooms.findAllByCoordinatorUsernameOrderByIdAsc(caller.getUsername());
            case ADMIN -> rooms.findAllByOrderByIdAsc();
        };
        return visible.stream()
                .map(r -> ChatRoomView.of(r, caller.getRole()))
                .toList();
    }

    public ChatRoom findRoom(Long roomId) {
        return rooms.findById(roomId)
                .orElseThrow(() -> new NotFoundException("Chat room " + roomId + " not found"));
    }

    public ChatRoom requireReadable(User caller, Long roomId) {
        ChatRoom room = findRoom(roomId);
        if (caller.getRole() != UserRole.ADMIN && !room.hasMember(caller.getUsername())) {
            throw new ForbiddenException("Access to room " + roomId + " denied");
        }
        return room;
    }
}

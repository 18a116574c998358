package com.fieldops.dismantle.chatroom;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ChatRoomRepository extends JpaRepository<ChatRoom, Long> {

    Optional<ChatRoom> findByTechnicianUsernameAndCoordinatorUsername(String technicianUsername,
                                                                      String coordinatorUsername);

    List<ChatRoom> findAllByTechnicianUsernameOrderByIdAsc(String technicianUsername);

    List<ChatRoom> findAllByCoordinatorUsernameOrderByIdAsc(String coordinatorUsername);

    List<ChatRoom> findAllByOrderByIdAsc();

    /* Counters are changed in place by the database; never read-modify-write. */

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChatRoom r set r.lastMessage = :text, r.lastMessageAt = :at, r.updatedAt = :at, "
            + "r.unreadCountCoordinator = r.unreadCountCoordinator + 1 where r.id = :roomId")
    int recordMessageFromTechnician(@Param("roomId") Long roomId,
                                    @Param("text") String text,
                                    @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChatRoom r set r.lastMessage = :text, r.lastMessageAt = :at, r.updatedAt = :at, "
            + "r.unreadCountTechnician = r.unreadCountTechnician + 1 where r.id = :roomId")
    int recordMessageFromCoordinator(@Param("roomId") Long roomId,
                                     @Param("text") String text,
                                     @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChatRoom r set r.unreadCountTechnician = 0, r.updatedAt = :at where r.id = :roomId")
    int resetTechnicianUnread(@Param("roomId") Long roomId, @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChatRoom r set r.unreadCountCoordinator = 0, r.updatedAt = :at where r.id = :roomId")
    int resetCoordinatorUnread(@Param("roomId") Long roomId, @Param("at") LocalDateTime at);
}

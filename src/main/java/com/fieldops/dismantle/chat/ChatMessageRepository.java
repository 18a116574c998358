package com.fieldops.dismantle.chat;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    /** Newest first; the caller reverses the page. */
    @Query(value = "SELECT * FROM chat_messages WHERE room_id = :roomId "
            + "ORDER BY created_at DESC, id DESC LIMIT :limit OFFSET :skip",
            nativeQuery = true)
    List<ChatMessage> findPageNewestFirst(@Param("roomId") Long roomId,
                                          @Param("skip") int skip,
                                          @Param("limit") int limit);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ChatMessage m set m.read = true "
            + "where m.roomId = :roomId and m.senderUsername <> :reader and m.read = false")
    int markReadFor(@Param("roomId") Long roomId, @Param("reader") String reader);
}

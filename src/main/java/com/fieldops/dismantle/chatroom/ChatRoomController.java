package com.fieldops.dismantle.chatroom;

import com.fieldops.dismantle.chat.ChatMessageService;
import com.fieldops.dismantle.chat.MessageView;
import com.fieldops.dismantle.user.IdentityDirectory;
import com.fieldops.dismantle.user.User;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Non-realtime surface: room list, create-or-fetch and message history.
 * The caller is the {@code X-Client-Id} set by the authentication layer.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/chat/rooms")
public class ChatRoomController {

    public static final String CALLER_HEADER = "X-Client-Id";

    private final ChatRoomService    chatRoomService;
    private final ChatMessageService chatMessageService;
    private final IdentityDirectory  directory;

    /** Technician: own rooms; coordinator: assigned rooms; admin: all. */
    @GetMapping
    public ResponseEntity<ApiResponse<List<ChatRoomView>>> rooms(@RequestHeader(CALLER_HEADER) String caller) {
        User user = directory.requireCaller(caller);
        return ResponseEntity.ok(ApiResponse.success(chatRoomService.listRoomsFor(user)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ChatRoomView>> createOrFetch(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestParam("technician_username") String technicianUsername) {
        User user = directory.requireCaller(caller);
        ChatRoom room = chatRoomService.createOrFetch(user, technicianUsername);
        return ResponseEntity.ok(ApiResponse.success(ChatRoomView.summary(room)));
    }

    /** Oldest first; {@code skip} counts from the newest message. */
    @GetMapping("/{roomId}/messages")
    public ResponseEntity<ApiResponse<List<MessageView>>> messages(
            @RequestHeader(CALLER_HEADER) String caller,
            @PathVariable Long roomId,
            @RequestParam(defaultValue = "0") int skip,
            @RequestParam(required = false) Integer limit) {
        User user = directory.requireCaller(caller);
        chatRoomService.requireReadable(user, roomId);
        List<MessageView> page = chatMessageService.history(roomId, skip, limit).stream()
                .map(MessageView::of)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(page));
    }
}

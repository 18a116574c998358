package com.fieldops.dismantle.chatroom;

import com.fieldops.dismantle.chat.ChatMessage;
import com.fieldops.dismantle.chat.ChatMessageService;
import com.fieldops.dismantle.chat.MessageType;
import com.fieldops.dismantle.exception.ForbiddenException;
import com.fieldops.dismantle.exception.NotFoundException;
import com.fieldops.dismantle.user.IdentityDirectory;
import com.fieldops.dismantle.user.User;
import com.fieldops.dismantle.user.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ChatRoomController.class)
class ChatRoomControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ChatRoomService chatRoomService;
    @MockBean
    private ChatMessageService chatMessageService;
    @MockBean
    private IdentityDirectory directory;

    private final User reg1 = User.builder().id(2L).username("reg1").role(UserRole.COORDINATOR)
            .area("Jakarta").region("WEST").build();

    private final ChatRoom room = ChatRoom.builder().id(7L)
            .technicianUsername("tek1").coordinatorUsername("reg1").region("WEST")
            .lastMessage("unit collected").lastMessageAt(LocalDateTime.of(2024, 5, 2, 9, 30, 15))
            .unreadCountCoordinator(3).unreadCountTechnician(0)
            .createdAt(LocalDateTime.of(2024, 5, 1, 8, 0))
            .build();

    @BeforeEach
    void setUp() {
        when(directory.requireCaller("reg1")).thenReturn(reg1);
    }

    @Test
    void listsRoomsWithCallersOwnUnreadCount() throws Exception {
        when(chatRoomService.listRoomsFor(reg1)).thenReturn(List.of(ChatRoomView.of(room, UserRole.COORDINATOR)));

        mvc.perform(get("/chat/rooms").header(ChatRoomController.CALLER_HEADER, "reg1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data[0].id").value(7))
                .andExpect(jsonPath("$.data[0].technician_username").value("tek1"))
                .andExpect(jsonPath("$.data[0].last_message_at").value("2024-05-02 09:30:15"))
                .andExpect(jsonPath("$.data[0].unread_count").value(3));
    }

    @Test
    void createOrFetchReturnsRoomSummary() throws Exception {
        when(chatRoomService.createOrFetch(reg1, "tek1")).thenReturn(room);

        mvc.perform(post("/chat/rooms")
                        .header(ChatRoomController.CALLER_HEADER, "reg1")
                        .param("technician_username", "tek1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value(7))
                .andExpect(jsonPath("$.data.coordinator_username").value("reg1"))
                .andExpect(jsonPath("$.data.region").value("WEST"))
                .andExpect(jsonPath("$.data.unread_count").doesNotExist());
    }

    @Test
    void historyIsServedOldestFirstWithDefaultLimit() throws Exception {
        ChatMessage first = ChatMessage.builder().id(1L).roomId(7L).senderUsername("tek1")
                .senderRole(UserRole.TECHNICIAN).body("on site").messageType(MessageType.TEXT)
                .createdAt(LocalDateTime.of(2024, 5, 2, 9, 0)).build();
        ChatMessage second = ChatMessage.builder().id(2L).roomId(7L).senderUsername("reg1")
                .senderRole(UserRole.COORDINATOR).body("photo please").messageType(MessageType.TEXT)
                .read(true).createdAt(LocalDateTime.of(2024, 5, 2, 9, 1)).build();
        when(chatRoomService.requireReadable(reg1, 7L)).thenReturn(room);
        when(chatMessageService.history(7L, 0, null)).thenReturn(List.of(first, second));

        mvc.perform(get("/chat/rooms/7/messages").header(ChatRoomController.CALLER_HEADER, "reg1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].message").value("on site"))
                .andExpect(jsonPath("$.data[0].sender_role").value("technician"))
                .andExpect(jsonPath("$.data[0].message_type").value("text"))
                .andExpect(jsonPath("$.data[1].is_read").value(true))
                .andExpect(jsonPath("$.data[1].created_at").value("2024-05-02 09:01:00"));
    }

    @Test
    void historyPassesPagingThrough() throws Exception {
        when(chatRoomService.requireReadable(reg1, 7L)).thenReturn(room);
        when(chatMessageService.history(7L, 20, 10)).thenReturn(List.of());

        mvc.perform(get("/chat/rooms/7/messages")
                        .header(ChatRoomController.CALLER_HEADER, "reg1")
                        .param("skip", "20")
                        .param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }

    @Test
    void outsiderGetsForbidden() throws Exception {
        when(chatRoomService.requireReadable(reg1, 9L)).thenThrow(new ForbiddenException("Access to room 9 denied"));

        mvc.perform(get("/chat/rooms/9/messages").header(ChatRoomController.CALLER_HEADER, "reg1"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.status").value(403))
                .andExpect(jsonPath("$.message").value("Access to room 9 denied"))
                .andExpect(jsonPath("$.path").value("/chat/rooms/9/messages"));
        verify(chatMessageService, never()).history(any(), eq(0), any());
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        when(chatRoomService.requireReadable(reg1, 404L)).thenThrow(new NotFoundException("Chat room 404 not found"));

        mvc.perform(get("/chat/rooms/404/messages").header(ChatRoomController.CALLER_HEADER, "reg1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    void missingCallerHeaderIsRejected() throws Exception {
        mvc.perform(get("/chat/rooms"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Failed"));
    }

    @Test
    void missingTechnicianParameterIsRejected() throws Exception {
        mvc.perform(post("/chat/rooms").header(ChatRoomController.CALLER_HEADER, "reg1"))
                .andExpect(status().isBadRequest());
    }
}

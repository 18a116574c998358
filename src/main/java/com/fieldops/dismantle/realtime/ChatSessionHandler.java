package com.fieldops.dismantle.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fieldops.dismantle.chat.ChatMessage;
import com.fieldops.dismantle.chat.ChatMessageService;
import com.fieldops.dismantle.chat.MessageType;
import com.fieldops.dismantle.chat.MessageView;
import com.fieldops.dismantle.chat.SendMessageCommand;
import com.fieldops.dismantle.chatroom.ChatRoom;
import com.fieldops.dismantle.chatroom.ChatRoomService;
import com.fieldops.dismantle.config.ChatProperties;
import com.fieldops.dismantle.config.IdentityHandshakeInterceptor;
import com.fieldops.dismantle.exception.BadRequestException;
import com.fieldops.dismantle.exception.ChatException;
import com.fieldops.dismantle.exception.ForbiddenException;
import com.fieldops.dismantle.user.UserRole;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;

/**
 * Per-connection control loop. The container delivers the frames of one
 * session one at a time, so actions of a connection never interleave.
 *
 * <pre>
 *   CONNECTING ──registered──▶ OPEN ──transport close / fault──▶ CLOSED
 *                               ▲ │
 *                               └─┘ send_message, mark_read, rejected frames
 * </pre>
 *
 * Rejected frames ({@code bad_request}, {@code not_found}, {@code forbidden})
 * are logged and answered with an error frame to the sender; the connection
 * stays open. Any other fault closes it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatSessionHandler extends TextWebSocketHandler {

    static final String STATE_ATTRIBUTE = "chat.state";

    private final ConnectionRegistry registry;
    private final MessageBroadcaster broadcaster;
    private final ChatMessageService messageService;
    private final ChatRoomService    roomService;
    private final ChatProperties     properties;
    private final ObjectMapper       objectMapper;

    /* =======================================================================
                                  LIFECYCLE
       ======================================================================= */

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        session.getAttributes().put(STATE_ATTRIBUTE, SessionState.CONNECTING);
        String identity = identityOf(session);
        if (identity == null) {
            log.warn("Connection {} has no identity, closing", session.getId());
            session.getAttributes().put(STATE_ATTRIBUTE, SessionState.CLOSED);
            session.close(CloseStatus.POLICY_VIOLATION);
            return;
        }
        registry.connect(identity, session);
        session.getAttributes().put(STATE_ATTRIBUTE, SessionState.OPEN);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        session.getAttributes().put(STATE_ATTRIBUTE, SessionState.CLOSED);
        String identity = identityOf(session);
        if (identity != null) {
            registry.disconnect(identity, session);
        }
        log.info("Connection {} of {} closed ({})", session.getId(), identity, status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on {} of {}: {}", session.getId(), identityOf(session), exception.toString());
        close(session, CloseStatus.SERVER_ERROR);
    }

    /* =======================================================================
                                 FRAME LOOP
       ======================================================================= */

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage frame) {
        if (stateOf(session) != SessionState.OPEN) {
            log.debug("Frame on {} ignored, session is {}", session.getId(), stateOf(session));
            return;
        }
        String identity = identityOf(session);
        MDC.put("userId", identity);
        try {
            ChatAction action = parse(frame.getPayload());
            if (action.roomId() != null) {
                MDC.put("roomId", String.valueOf(action.roomId()));
            }
            dispatch(identity, action);

        } catch (ChatException ex) {
            log.warn("Frame from {} rejected ({}): {}", identity, ex.code(), ex.getMessage());
            registry.reply(identity, session, ChatEvent.error(ex));

        } catch (RuntimeException ex) {
            log.error("Unexpected fault on connection {} of {}, closing", session.getId(), identity, ex);
            close(session, CloseStatus.SERVER_ERROR);

        } finally {
            MDC.remove("roomId");
            MDC.remove("userId");
        }
    }

    private ChatAction parse(String payload) {
        try {
            ChatAction action = objectMapper.readValue(payload, ChatAction.class);
            if (action == null) {
                throw new BadRequestException("Empty frame");
            }
            return action;
        } catch (JsonProcessingException ex) {
            throw new BadRequestException("Malformed frame: " + ex.getOriginalMessage());
        }
    }

    private void dispatch(String identity, ChatAction action) {
        String name = action.action() == null ? "" : action.action();
        switch (name) {
            case ChatAction.SEND_MESSAGE -> onSendMessage(identity, action);
            case ChatAction.MARK_READ -> onMarkRead(identity, action);
            default -> throw new BadRequestException("Unsupported action '" + action.action() + "'");
        }
    }

    /* =======================================================================
                                  ACTIONS
       ======================================================================= */

    private void onSendMessage(String identity, ChatAction action) {
        if (action.roomId() == null || action.message() == null || action.senderRole() == null) {
            throw new BadRequestException("send_message requires room_id, message and sender_role");
        }
        UserRole senderRole = parseRole(action.senderRole(), "sender_role");
        MessageType type    = parseType(action.messageType());
        checkMembership(identity, action.roomId(), senderRole);

        ChatMessage saved = messageService.send(new SendMessageCommand(
                action.roomId(), identity, senderRole, action.message(), type, action.attachmentUrl()));

        // committed above; the sender gets its own echo as confirmation
        broadcaster.broadcast(saved.getRoomId(), ChatEvent.newMessage(MessageView.of(saved)));
    }

    private void onMarkRead(String identity, ChatAction action) {
        if (action.roomId() == null || action.role() == null) {
            throw new BadRequestException("mark_read requires room_id and role");
        }
        UserRole role = parseRole(action.role(), "role");
        checkMembership(identity, action.roomId(), role);

        messageService.markRead(action.roomId(), role, identity);
    }

    private void checkMembership(String identity, Long roomId, UserRole declared) {
        if (!properties.getRealtime().isEnforceMembership()) {
            return;
        }
        ChatRoom room = roomService.findRoom(roomId);
        UserRole slot = room.roleOf(identity);
        if (slot == null) {
            throw new ForbiddenException(identity + " is not a member of room " + roomId);
        }
        if (slot != declared) {
            throw new ForbiddenException(identity + " is the " + slot.wireName()
                    + " of room " + roomId + ", not the " + declared.wireName());
        }
    }

    private static UserRole parseRole(String raw, String field) {
        UserRole role;
        try {
            role = UserRole.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException(field + ": " + ex.getMessage());
        }
        if (!role.isParticipant()) {
            throw new BadRequestException(field + " must be technician or coordinator");
        }
        return role;
    }

    private static MessageType parseType(String raw) {
        try {
            return MessageType.fromValue(raw);
        } catch (IllegalArgumentException ex) {
            throw new BadRequestException("message_type: " + ex.getMessage());
        }
    }

    /* =======================================================================
                                  HELPERS
       ======================================================================= */

    private void close(WebSocketSession session, CloseStatus status) {
        session.getAttributes().put(STATE_ATTRIBUTE, SessionState.CLOSED);
        String identity = identityOf(session);
        if (identity != null) {
            registry.disconnect(identity, session);
        }
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException ex) {
            log.debug("Close of {} failed: {}", session.getId(), ex.toString());
        }
    }

    static String identityOf(WebSocketSession session) {
        Object identity = session.getAttributes().get(IdentityHandshakeInterceptor.IDENTITY_ATTRIBUTE);
        return identity == null ? null : identity.toString();
    }

    static SessionState stateOf(WebSocketSession session) {
        Object state = session.getAttributes().get(STATE_ATTRIBUTE);
        return state instanceof SessionState s ? s : SessionState.CONNECTING;
    }
}

package com.fieldops.dismantle.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fieldops.dismantle.chat.MessageView;
import com.fieldops.dismantle.exception.ChatException;

/**
 * Outbound frame. {@code new_message} carries {@code message}; {@code error}
 * carries {@code code} and {@code detail} and goes to the sender only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatEvent(String type, MessageView message, String code, String detail) {

    public static final String NEW_MESSAGE = "new_message";
    public static final String ERROR = "error";

    public static ChatEvent newMessage(MessageView message) {
        return new ChatEvent(NEW_MESSAGE, message, null, null);
    }

    public static ChatEvent error(ChatException ex) {
        return new ChatEvent(ERROR, null, ex.code(), ex.getMessage());
    }
}

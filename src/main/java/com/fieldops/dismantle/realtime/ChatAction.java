package com.fieldops.dismantle.realtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound frame. Roles and message type stay raw strings so that a bad value
 * is reported as {@code bad_request} instead of failing the whole frame.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatAction(
        String action,
        @JsonProperty("room_id") Long roomId,
        String message,
        @JsonProperty("sender_role") String senderRole,
        @JsonProperty("message_type") String messageType,
        @JsonProperty("attachment_url") String attachmentUrl,
        String role
) {

    public static final String SEND_MESSAGE = "send_message";
    public static final String MARK_READ = "mark_read";
}

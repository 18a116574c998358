package com.fieldops.dismantle.chat;

import com.fieldops.dismantle.user.UserRole;

public record SendMessageCommand(
        Long roomId,
        String senderUsername,
        UserRole senderRole,
        String body,
        MessageType messageType,
        String attachmentUrl
) {}

package com.fieldops.dismantle.chat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum MessageType {

    TEXT("text"),
    IMAGE("image"),
    /** link to a work order */
    WO_LINK("wo_link");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** {@code null} or blank means {@link #TEXT}. */
    @JsonCreator
    public static MessageType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        return Arrays.stream(values())
                .filter(t -> t.wireName.equalsIgnoreCase(value.trim()) || t.name().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown message type: " + value));
    }
}

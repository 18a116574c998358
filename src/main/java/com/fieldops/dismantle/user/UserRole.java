package com.fieldops.dismantle.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Roles known to the identity directory. Only {@link #TECHNICIAN} and
 * {@link #COORDINATOR} take part in a room.
 */
public enum UserRole {

    TECHNICIAN("technician", "teknisi"),
    COORDINATOR("coordinator", "admin_regional"),
    ADMIN("admin", "admin");

    private final String wireName;
    private final String legacyName;

    UserRole(String wireName, String legacyName) {
        this.wireName = wireName;
        this.legacyName = legacyName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isParticipant() {
        return this != ADMIN;
    }

    /** Accepts the wire name, the legacy name or the constant name, case-insensitively. */
    @JsonCreator
    public static UserRole fromValue(String value) {
        if (value == null) {
            return null;
        }
        String v = value.trim();
        return Arrays.stream(values())
                .filter(r -> r.wireName.equalsIgnoreCase(v)
                        || r.legacyName.equalsIgnoreCase(v)
                        || r.name().equalsIgnoreCase(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + value));
    }
}

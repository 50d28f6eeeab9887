package com.herotasks.realtime.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnvelopeType {

    // Task content, emitted by application code
    TASK_CREATED("task_created"),
    TASK_UPDATED("task_updated"),
    TASK_DELETED("task_deleted"),
    TASK_STATUS_CHANGED("task_status_changed"),

    // Presence
    USER_JOINED("user_joined"),
    USER_LEFT("user_left"),
    TYPING("typing"),

    // Liveness
    PING("ping"),
    PONG("pong"),

    // Client → Server room membership
    JOIN_TASK("join_task"),
    LEAVE_TASK("leave_task"),

    /** Any type string this server does not know. Never sent. */
    UNKNOWN("unknown");

    private final String wireName;

    EnvelopeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isTaskEvent() {
        return this == TASK_CREATED || this == TASK_UPDATED
                || this == TASK_DELETED || this == TASK_STATUS_CHANGED;
    }

    public boolean isPresenceEvent() {
        return this == USER_JOINED || this == USER_LEFT || this == TYPING;
    }

    @JsonCreator
    public static EnvelopeType fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EnvelopeType type : values()) {
            if (type != UNKNOWN && type.wireName.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}

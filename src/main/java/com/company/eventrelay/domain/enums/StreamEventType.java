package com.company.eventrelay.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Typed events emitted on a host's real-time stream.
 */
public enum StreamEventType {

    CONNECTED("connected"),
    NOTIFICATION("notification"),
    BOOKING_UPDATE("booking_update"),
    HEARTBEAT("heartbeat"),
    SYSTEM_ANNOUNCEMENT("system_announcement");

    private final String value;

    StreamEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

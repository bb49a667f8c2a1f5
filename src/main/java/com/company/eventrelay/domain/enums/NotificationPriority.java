package com.company.eventrelay.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Display priority of a host notification.
 */
public enum NotificationPriority {

    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String value;

    NotificationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NotificationPriority fromValue(String value) {
        return Arrays.stream(values())
                .filter(priority -> priority.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid priority '" + value + "'. Must be one of: [high, medium, low]"));
    }
}

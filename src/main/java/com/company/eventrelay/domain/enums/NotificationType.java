package com.company.eventrelay.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of in-app notification types shown on the host dashboard.
 */
public enum NotificationType {

    NEW_BOOKING("new_booking"),
    PAYMENT_RECEIVED("payment_received"),
    GUEST_MESSAGE("guest_message"),
    URGENT("urgent"),
    BOOKING_UPDATE("booking_update");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a notification type from its wire value.
     *
     * @param value The wire value, e.g. {@code new_booking}
     * @return the matching type
     * @throws IllegalArgumentException if the value is not a known type
     */
    @JsonCreator
    public static NotificationType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Invalid notification type '" + value + "'. Must be one of: "
                                + Arrays.toString(Arrays.stream(values()).map(NotificationType::getValue).toArray())));
    }
}

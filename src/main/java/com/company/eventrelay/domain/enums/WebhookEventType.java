package com.company.eventrelay.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Enumeration of the event types external subscribers can register for.
 * The wire value (e.g. {@code booking.created}) is what subscribers see in the
 * payload and what is stored against a subscription.
 */
public enum WebhookEventType {

    /**
     * A guest created a booking request.
     */
    BOOKING_CREATED("booking.created"),

    /**
     * A booking was confirmed by the host.
     */
    BOOKING_CONFIRMED("booking.confirmed"),

    /**
     * A booking was cancelled.
     */
    BOOKING_CANCELLED("booking.cancelled"),

    /**
     * A payment for a booking was received.
     */
    PAYMENT_RECEIVED("payment.received"),

    /**
     * The host has to respond to something (e.g. a guest message).
     */
    HOST_RESPONSE_NEEDED("host.response_needed"),

    /**
     * Event for testing webhook connectivity.
     */
    TEST("test.webhook");

    private final String value;

    WebhookEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Checks if this event type originates from the booking domain
     * and therefore produces a host notification when dispatched.
     *
     * @return true for domain events, false for the test event
     */
    public boolean isDomainEvent() {
        return this != TEST;
    }

    /**
     * Resolves an event type from its wire value.
     *
     * @param value The wire value, e.g. {@code payment.received}
     * @return the matching event type, or empty if the value is unknown
     */
    public static Optional<WebhookEventType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }

    /**
     * Checks if a wire value belongs to the event vocabulary.
     *
     * @param value The wire value
     * @return true if the value is a known event type
     */
    public static boolean isValid(String value) {
        return fromValue(value).isPresent();
    }

    /**
     * Gets all wire values in declaration order.
     *
     * @return List of valid event names
     */
    public static List<String> allValues() {
        return Arrays.stream(values())
                .map(WebhookEventType::getValue)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return value;
    }
}

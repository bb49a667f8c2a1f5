package com.company.eventrelay.domain.enums;

/**
 * Overall outcome of delivering one event to all matching subscribers.
 * None of these values is an error for the code that raised the event.
 */
public enum DeliveryStatus {

    /**
     * No active subscription is interested in the event. Informational only.
     */
    NO_SUBSCRIBERS,

    /**
     * Every matching subscriber acknowledged the event.
     */
    DELIVERED,

    /**
     * Some subscribers acknowledged the event, others exhausted their retries.
     */
    PARTIAL_FAILURE,

    /**
     * No subscriber acknowledged the event.
     */
    ALL_FAILED
}

package com.company.eventrelay.api.exception;

import java.util.UUID;

/**
 * Exception thrown when a webhook subscription cannot be found.
 */
public class SubscriptionNotFoundException extends RuntimeException {

    private final UUID subscriptionId;

    public SubscriptionNotFoundException(UUID subscriptionId) {
        super("Subscription not found with ID: " + subscriptionId);
        this.subscriptionId = subscriptionId;
    }

    public UUID getSubscriptionId() {
        return subscriptionId;
    }
}

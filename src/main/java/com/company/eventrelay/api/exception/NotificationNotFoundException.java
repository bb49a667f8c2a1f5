package com.company.eventrelay.api.exception;

import java.util.UUID;

/**
 * Exception thrown when a notification does not exist or is not owned by the
 * requesting host. Both cases produce the same message so a caller cannot
 * discover notifications of other hosts.
 */
public class NotificationNotFoundException extends RuntimeException {

    private final UUID notificationId;

    public NotificationNotFoundException(UUID notificationId) {
        super("Notification not found with ID: " + notificationId);
        this.notificationId = notificationId;
    }

    public UUID getNotificationId() {
        return notificationId;
    }
}

package com.company.eventrelay.domain.service.notification;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Everything needed to create a notification for a host.
 */
@Value
@Builder
public class NewNotification {

    String hostId;
    NotificationType type;
    String title;
    String message;

    @Builder.Default
    NotificationPriority priority = NotificationPriority.MEDIUM;

    String bookingId;
    String propertyId;
    boolean actionRequired;
    String actionUrl;

    /**
     * Null means the notification never expires.
     */
    LocalDateTime expiresAt;
}

package com.company.eventrelay.domain.repository;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import lombok.Builder;
import lombok.Value;

/**
 * Criteria for listing a host's notifications. Null filters are not applied.
 * Expired notifications are never listed.
 */
@Value
@Builder
public class NotificationFilter {

    String hostId;
    boolean unreadOnly;
    NotificationType type;
    NotificationPriority priority;
}

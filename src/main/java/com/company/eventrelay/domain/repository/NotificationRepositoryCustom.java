package com.company.eventrelay.domain.repository;

import com.company.eventrelay.domain.model.Notification;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Filtered, offset-paged listing of a host's notifications.
 */
public interface NotificationRepositoryCustom {

    List<Notification> search(NotificationFilter filter, LocalDateTime now, int offset, int limit);

    long count(NotificationFilter filter, LocalDateTime now);
}

package com.company.eventrelay.domain.service.notification;

import com.company.eventrelay.domain.model.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a host's notifications, newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPage {

    private List<Notification> notifications;
    private long totalCount;
    private long unreadCount;
    private int returnedCount;
    private int offset;
    private int limit;
    private boolean hasMore;
}

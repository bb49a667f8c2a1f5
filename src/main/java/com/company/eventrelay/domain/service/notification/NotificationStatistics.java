package com.company.eventrelay.domain.service.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationStatistics {

    private long totalNotifications;
    private long unreadNotifications;
    private long readNotifications;

    @JsonProperty("recent_notifications_7d")
    private long recentNotifications7d;

    private Map<String, Long> byType;
    private Map<String, Long> byPriority;

    /**
     * Share of read notifications, as a percentage with one decimal.
     */
    private double readPercentage;
}

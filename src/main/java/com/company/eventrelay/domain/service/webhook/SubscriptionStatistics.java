package com.company.eventrelay.domain.service.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregate health figures of the subscription registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionStatistics {

    private long totalSubscriptions;
    private long activeSubscriptions;
    private long inactiveSubscriptions;

    /**
     * Subscriptions whose last acknowledged delivery is within the last 24 hours.
     */
    @JsonProperty("recent_successful_calls_24h")
    private long recentSuccessfulCalls24h;

    /**
     * Recent successes relative to the active subscriptions, as a percentage with two decimals.
     */
    private double successRate;
}

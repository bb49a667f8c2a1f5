package com.company.eventrelay.api.dto;

import com.company.eventrelay.domain.model.WebhookSubscription;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Data Transfer Object exposing a subscription without its secret.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionResponse {

    private UUID id;
    private String agentName;
    private String webhookUrl;
    private List<String> events;
    private Boolean isActive;
    private Integer failedAttempts;
    private Integer maxFailedAttempts;
    private LocalDateTime lastSuccessfulCall;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static SubscriptionResponse from(WebhookSubscription subscription) {
        List<String> events = new ArrayList<>(subscription.getEvents());
        Collections.sort(events);

        return SubscriptionResponse.builder()
                .id(subscription.getId())
                .agentName(subscription.getAgentName())
                .webhookUrl(subscription.getWebhookUrl())
                .events(events)
                .isActive(subscription.getIsActive())
                .failedAttempts(subscription.getFailedAttempts())
                .maxFailedAttempts(subscription.getMaxFailedAttempts())
                .lastSuccessfulCall(subscription.getLastSuccessfulCall())
                .createdAt(subscription.getCreatedAt())
                .updatedAt(subscription.getUpdatedAt())
                .build();
    }
}

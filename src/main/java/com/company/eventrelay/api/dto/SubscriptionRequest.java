package com.company.eventrelay.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Data Transfer Object for webhook subscription registration requests.
 * Event names are checked against the vocabulary by the registry, which reports
 * every invalid entry at once.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionRequest {

    /**
     * Display label of the subscriber.
     */
    @NotBlank(message = "Agent name is required")
    private String agentName;

    /**
     * Endpoint that will receive the signed callbacks.
     */
    @NotBlank(message = "Webhook URL is required")
    private String webhookUrl;

    /**
     * Event types to subscribe to.
     */
    @NotEmpty(message = "At least one event type must be specified")
    private List<String> events;

    /**
     * Shared secret used to sign payloads. Never echoed back.
     */
    @ToString.Exclude
    @NotBlank(message = "Secret key is required")
    private String secretKey;

    /**
     * Consecutive failed deliveries before deactivation. Optional.
     */
    private Integer maxFailedAttempts;
}

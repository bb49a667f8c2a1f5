package com.company.eventrelay.domain.service.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Outcome of delivering one event to one subscriber, retries included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SubscriberOutcome {

    private UUID subscriptionId;
    private String agentName;
    private boolean delivered;

    /**
     * Number of HTTP calls made.
     */
    private int attempts;

    /**
     * Status of the last response, if any.
     */
    private Integer statusCode;

    private String error;
    private long durationMs;

    /**
     * Whether this delivery's failure switched the subscription off.
     */
    private boolean deactivated;

    /**
     * Set when the delivery was interrupted during backoff; no failure was recorded.
     */
    private boolean aborted;
}

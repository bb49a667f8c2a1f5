package com.company.eventrelay.domain.service.webhook;

import com.company.eventrelay.domain.enums.AttemptOutcome;
import lombok.Value;

/**
 * Result of one HTTP call to a subscriber. Drives the retry loop.
 */
@Value
public class DeliveryAttempt {

    AttemptOutcome outcome;

    /**
     * Response status, null when no response was received.
     */
    Integer statusCode;

    String error;
    long durationMs;

    static DeliveryAttempt success(int statusCode, long durationMs) {
        return new DeliveryAttempt(AttemptOutcome.SUCCESS, statusCode, null, durationMs);
    }

    static DeliveryAttempt rejected(int statusCode, long durationMs) {
        return new DeliveryAttempt(AttemptOutcome.TRANSIENT_FAILURE, statusCode,
                "Subscriber responded with HTTP " + statusCode, durationMs);
    }

    static DeliveryAttempt transportFailure(String error, long durationMs) {
        return new DeliveryAttempt(AttemptOutcome.TRANSIENT_FAILURE, null, error, durationMs);
    }

    static DeliveryAttempt permanentFailure(String error) {
        return new DeliveryAttempt(AttemptOutcome.PERMANENT_FAILURE, null, error, 0L);
    }
}

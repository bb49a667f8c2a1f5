package com.company.eventrelay.domain.service.webhook;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Exponential backoff between webhook delivery attempts.
 *
 * <p>Delay formula: {@code base * multiplier^(attempt-1)}, capped at {@code max}.
 * With the defaults this gives 2s after the first failed attempt and 4s after the second.
 */
@Component
public class RetryBackoffPolicy {

    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;

    public RetryBackoffPolicy(
            @Value("${webhook.delivery.backoff-base-ms:2000}") long baseDelayMs,
            @Value("${webhook.delivery.backoff-multiplier:2.0}") double multiplier,
            @Value("${webhook.delivery.backoff-max-ms:60000}") long maxDelayMs) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Computes the pause after a failed attempt.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay in milliseconds before the next attempt
     */
    public long delayAfterAttempt(int failedAttempt) {
        if (failedAttempt <= 0) {
            return 0L;
        }
        double delay = baseDelayMs * Math.pow(multiplier, failedAttempt - 1);
        if (Double.isInfinite(delay) || delay >= maxDelayMs) {
            return maxDelayMs;
        }
        return (long) delay;
    }
}

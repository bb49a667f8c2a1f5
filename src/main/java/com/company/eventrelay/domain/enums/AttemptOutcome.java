package com.company.eventrelay.domain.enums;

/**
 * Result of a single HTTP call to a subscriber. Drives the retry loop.
 */
public enum AttemptOutcome {

    /**
     * The subscriber answered with a 2xx status.
     */
    SUCCESS,

    /**
     * Non-2xx response or transport error. Worth retrying.
     */
    TRANSIENT_FAILURE,

    /**
     * The request cannot succeed by repeating it (e.g. malformed URL).
     */
    PERMANENT_FAILURE;

    public boolean isRetryable() {
        return this == TRANSIENT_FAILURE;
    }
}

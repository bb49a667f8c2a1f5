package com.company.eventrelay.api.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception thrown when a subscription request is malformed: an unknown
 * event name, an empty event list, a missing or non-HTTP URL, a blank
 * agent name or a secret that is too short.
 * Never retried; the offending fields are reported back to the caller.
 */
public class SubscriptionValidationException extends RuntimeException {

    private final Map<String, Object> fieldErrors;

    /**
     * Constructs a new SubscriptionValidationException.
     *
     * @param message The summary message
     * @param fieldErrors Offending field names mapped to what was wrong with them
     */
    public SubscriptionValidationException(String message, Map<String, Object> fieldErrors) {
        super(message);
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    /**
     * Gets the offending fields.
     *
     * @return Field name to error detail
     */
    public Map<String, Object> getFieldErrors() {
        return fieldErrors;
    }
}

package com.company.eventrelay.domain.service.event;

import lombok.Value;

/**
 * Identifiers tying an event to booking domain records. Both are optional.
 */
@Value(staticConstructor = "of")
public class EventCorrelation {

    String bookingId;
    String propertyId;

    public static EventCorrelation none() {
        return of(null, null);
    }
}

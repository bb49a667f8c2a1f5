package com.company.eventrelay.domain.service.stream;

import com.company.eventrelay.domain.model.BookingChange;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read access to bookings of a host's properties that changed recently.
 */
public interface BookingChangeFeed {

    /**
     * Finds bookings updated at or after {@code since}, newest first.
     *
     * @param hostId Owner of the properties
     * @param since Lower bound on the booking's update time
     * @param limit Maximum number of rows
     * @return Changed bookings, possibly empty
     */
    List<BookingChange> changedSince(String hostId, LocalDateTime since, int limit);
}

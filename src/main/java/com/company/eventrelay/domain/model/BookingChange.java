package com.company.eventrelay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Read-only snapshot of a booking row that changed, as streamed to the host.
 * The bookings table itself belongs to the booking domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingChange {

    private String bookingId;
    private String status;
    private String propertyId;
    private String propertyTitle;
    private String guestName;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private BigDecimal totalAmount;
    private LocalDateTime updatedAt;
    private LocalDateTime createdAt;
}

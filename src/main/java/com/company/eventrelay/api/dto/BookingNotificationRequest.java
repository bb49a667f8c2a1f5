package com.company.eventrelay.api.dto;

import com.company.eventrelay.domain.service.notification.BookingNotificationKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingNotificationRequest {

    @NotBlank(message = "Booking id is required")
    private String bookingId;

    @NotBlank(message = "Property id is required")
    private String propertyId;

    @NotNull(message = "Notification kind is required")
    private BookingNotificationKind kind;

    @NotBlank(message = "Guest name is required")
    private String guestName;

    @NotBlank(message = "Property title is required")
    private String propertyTitle;
}

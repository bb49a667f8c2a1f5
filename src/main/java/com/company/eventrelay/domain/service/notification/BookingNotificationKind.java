package com.company.eventrelay.domain.service.notification;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Standard booking notifications with their wording, priority and stored type.
 * Message formats take the guest name and the property title.
 */
public enum BookingNotificationKind {

    NEW_BOOKING("new_booking", NotificationType.NEW_BOOKING, NotificationPriority.HIGH, true,
            "New Booking Request", "You have a new booking request from %s for %s"),

    BOOKING_CONFIRMED("booking_confirmed", NotificationType.BOOKING_UPDATE, NotificationPriority.MEDIUM, false,
            "Booking Confirmed", "Booking from %s for %s has been confirmed"),

    BOOKING_CANCELLED("booking_cancelled", NotificationType.BOOKING_UPDATE, NotificationPriority.MEDIUM, false,
            "Booking Cancelled", "Booking from %s for %s has been cancelled"),

    PAYMENT_RECEIVED("payment_received", NotificationType.PAYMENT_RECEIVED, NotificationPriority.MEDIUM, false,
            "Payment Received", "Payment received for booking from %s at %s");

    private final String value;
    private final NotificationType type;
    private final NotificationPriority priority;
    private final boolean actionRequired;
    private final String title;
    private final String messageFormat;

    BookingNotificationKind(String value, NotificationType type, NotificationPriority priority,
                            boolean actionRequired, String title, String messageFormat) {
        this.value = value;
        this.type = type;
        this.priority = priority;
        this.actionRequired = actionRequired;
        this.title = title;
        this.messageFormat = messageFormat;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public NotificationType getType() {
        return type;
    }

    public NotificationPriority getPriority() {
        return priority;
    }

    public boolean isActionRequired() {
        return actionRequired;
    }

    public String getTitle() {
        return title;
    }

    public String formatMessage(String guestName, String propertyTitle) {
        return String.format(messageFormat, guestName, propertyTitle);
    }

    @JsonCreator
    public static BookingNotificationKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown booking notification kind: " + value));
    }
}

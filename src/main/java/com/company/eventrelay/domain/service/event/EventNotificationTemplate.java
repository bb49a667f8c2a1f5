package com.company.eventrelay.domain.service.event;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import com.company.eventrelay.domain.enums.WebhookEventType;
import com.company.eventrelay.domain.service.notification.BookingNotificationKind;

import java.util.Arrays;
import java.util.Optional;

/**
 * How each domain event is shown to the host as a notification.
 */
enum EventNotificationTemplate {

    BOOKING_CREATED(WebhookEventType.BOOKING_CREATED, NotificationType.NEW_BOOKING, NotificationPriority.HIGH,
            true, true, BookingNotificationKind.NEW_BOOKING,
            "New Booking Request", "You have a new booking request"),

    BOOKING_CONFIRMED(WebhookEventType.BOOKING_CONFIRMED, NotificationType.BOOKING_UPDATE,
            NotificationPriority.MEDIUM, false, false, BookingNotificationKind.BOOKING_CONFIRMED,
            "Booking Confirmed", "A booking has been confirmed"),

    BOOKING_CANCELLED(WebhookEventType.BOOKING_CANCELLED, NotificationType.BOOKING_UPDATE,
            NotificationPriority.MEDIUM, false, false, BookingNotificationKind.BOOKING_CANCELLED,
            "Booking Cancelled", "A booking has been cancelled"),

    PAYMENT_RECEIVED(WebhookEventType.PAYMENT_RECEIVED, NotificationType.PAYMENT_RECEIVED,
            NotificationPriority.MEDIUM, false, false, BookingNotificationKind.PAYMENT_RECEIVED,
            "Payment Received", "A payment has been received"),

    HOST_RESPONSE_NEEDED(WebhookEventType.HOST_RESPONSE_NEEDED, NotificationType.URGENT, NotificationPriority.HIGH,
            true, false, null,
            "Response Needed", "A guest is waiting for your response");

    private final WebhookEventType eventType;
    private final NotificationType notificationType;
    private final NotificationPriority priority;
    private final boolean actionRequired;
    private final boolean expiring;
    private final BookingNotificationKind bookingKind;
    private final String defaultTitle;
    private final String defaultMessage;

    EventNotificationTemplate(WebhookEventType eventType, NotificationType notificationType,
                              NotificationPriority priority, boolean actionRequired, boolean expiring,
                              BookingNotificationKind bookingKind, String defaultTitle, String defaultMessage) {
        this.eventType = eventType;
        this.notificationType = notificationType;
        this.priority = priority;
        this.actionRequired = actionRequired;
        this.expiring = expiring;
        this.bookingKind = bookingKind;
        this.defaultTitle = defaultTitle;
        this.defaultMessage = defaultMessage;
    }

    static Optional<EventNotificationTemplate> forEvent(WebhookEventType eventType) {
        return Arrays.stream(values())
                .filter(template -> template.eventType == eventType)
                .findFirst();
    }

    NotificationType getNotificationType() {
        return notificationType;
    }

    NotificationPriority getPriority() {
        return priority;
    }

    boolean isActionRequired() {
        return actionRequired;
    }

    boolean isExpiring() {
        return expiring;
    }

    String getDefaultTitle() {
        return defaultTitle;
    }

    /**
     * Uses the booking wording when the guest and property are known.
     */
    String defaultMessage(String guestName, String propertyTitle) {
        if (bookingKind != null && guestName != null && propertyTitle != null) {
            return bookingKind.formatMessage(guestName, propertyTitle);
        }
        return defaultMessage;
    }
}

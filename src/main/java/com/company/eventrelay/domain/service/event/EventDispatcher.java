package com.company.eventrelay.domain.service.event;

import com.company.eventrelay.api.exception.NotificationRecordingException;
import com.company.eventrelay.domain.enums.WebhookEventType;
import com.company.eventrelay.domain.model.Notification;
import com.company.eventrelay.domain.service.notification.NewNotification;
import com.company.eventrelay.domain.service.notification.NotificationService;
import com.company.eventrelay.domain.service.webhook.WebhookDeliveryService;
import com.company.eventrelay.infrastructure.task.BackgroundTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Single entry point for domain events.
 * Records the host notification synchronously, then hands webhook delivery to the
 * background runner. Real-time streams pick the notification up by polling.
 */
@Service
public class EventDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final NotificationService notificationService;
    private final WebhookDeliveryService deliveryService;
    private final BackgroundTaskRunner taskRunner;

    public EventDispatcher(NotificationService notificationService,
                           WebhookDeliveryService deliveryService,
                           BackgroundTaskRunner taskRunner) {
        this.notificationService = notificationService;
        this.deliveryService = deliveryService;
        this.taskRunner = taskRunner;
    }

    /**
     * Dispatches a domain event.
     *
     * @param eventType The event wire value, e.g. {@code booking.confirmed}
     * @param hostId The host the event concerns
     * @param correlation Booking and property identifiers, may be null
     * @param payload Event data; {@code title} and {@code message} entries override the defaults
     * @return The recorded notification id and whether delivery was enqueued
     * @throws IllegalArgumentException if the event type is unknown, before anything is written
     * @throws NotificationRecordingException if the notification could not be stored
     */
    public DispatchResult dispatch(String eventType, String hostId, EventCorrelation correlation,
                                   Map<String, Object> payload) {
        WebhookEventType type = WebhookEventType.fromValue(eventType)
                .filter(WebhookEventType::isDomainEvent)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type '" + eventType
                        + "'. Must be one of: " + domainEventValues()));
        EventNotificationTemplate template = EventNotificationTemplate.forEvent(type)
                .orElseThrow(() -> new IllegalStateException("No notification template for " + eventType));

        EventCorrelation ids = correlation != null ? correlation : EventCorrelation.none();
        Map<String, Object> data = payload != null ? payload : Collections.emptyMap();

        Notification notification = recordNotification(eventType, hostId, template, ids, data);

        Map<String, Object> webhookData = new LinkedHashMap<>(data);
        if (ids.getBookingId() != null) {
            webhookData.putIfAbsent("booking_id", ids.getBookingId());
        }
        if (ids.getPropertyId() != null) {
            webhookData.putIfAbsent("property_id", ids.getPropertyId());
        }

        CompletableFuture<Boolean> completion;
        boolean enqueued;
        try {
            completion = taskRunner.submit("webhook-delivery:" + eventType,
                    () -> deliveryService.deliverEvent(eventType, webhookData));
            enqueued = true;
        } catch (RuntimeException e) {
            logger.error("Failed to enqueue webhook delivery for event {} (notification {})",
                    eventType, notification.getId(), e);
            completion = CompletableFuture.completedFuture(false);
            enqueued = false;
        }

        return DispatchResult.builder()
                .eventType(eventType)
                .notificationId(notification.getId())
                .deliveryEnqueued(enqueued)
                .deliveryCompletion(completion)
                .build();
    }

    private Notification recordNotification(String eventType, String hostId, EventNotificationTemplate template,
                                            EventCorrelation ids, Map<String, Object> data) {
        NewNotification request = NewNotification.builder()
                .hostId(hostId)
                .type(template.getNotificationType())
                .title(text(data, "title", template.getDefaultTitle()))
                .message(text(data, "message",
                        template.defaultMessage(text(data, "guest_name", null), text(data, "property_title", null))))
                .priority(template.getPriority())
                .bookingId(ids.getBookingId())
                .propertyId(ids.getPropertyId())
                .actionRequired(template.isActionRequired())
                .actionUrl(NotificationService.bookingActionUrl(ids.getBookingId()))
                .expiresAt(template.isExpiring() ? notificationService.newBookingExpiry() : null)
                .build();

        try {
            Notification notification = notificationService.create(request);
            logger.info("Dispatched event {} for host {} as notification {}", eventType, hostId, notification.getId());
            return notification;
        } catch (DataAccessException e) {
            logger.error("Failed to record notification for event {} and host {}", eventType, hostId, e);
            throw new NotificationRecordingException(eventType, hostId, e);
        }
    }

    private static String text(Map<String, Object> data, String key, String fallback) {
        Object value = data.get(key);
        if (value instanceof String && !((String) value).trim().isEmpty()) {
            return (String) value;
        }
        return fallback;
    }

    private static String domainEventValues() {
        StringBuilder values = new StringBuilder();
        for (WebhookEventType type : WebhookEventType.values()) {
            if (type.isDomainEvent()) {
                if (values.length() > 0) {
                    values.append(", ");
                }
                values.append(type.getValue());
            }
        }
        return values.toString();
    }
}

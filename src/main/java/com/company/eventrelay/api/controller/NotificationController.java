package com.company.eventrelay.api.controller;

import com.company.eventrelay.api.dto.BookingNotificationRequest;
import com.company.eventrelay.api.dto.NotificationRequest;
import com.company.eventrelay.api.exception.NotificationNotFoundException;
import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import com.company.eventrelay.domain.model.Notification;
import com.company.eventrelay.domain.service.notification.NewNotification;
import com.company.eventrelay.domain.service.notification.NotificationPage;
import com.company.eventrelay.domain.service.notification.NotificationService;
import com.company.eventrelay.domain.service.notification.NotificationStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST Controller for a host's in-app notifications.
 * The host in the path is taken as authenticated upstream.
 */
@RestController
@RequestMapping("/api/v1/hosts/{hostId}/notifications")
public class NotificationController {

    private static final Logger logger = LoggerFactory.getLogger(NotificationController.class);

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    /**
     * Lists notifications, newest first. Expired notifications are left out.
     */
    @GetMapping
    public ResponseEntity<NotificationPage> list(
            @PathVariable String hostId,
            @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset,
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "priority", required = false) String priority) {

        NotificationType typeFilter = type != null ? NotificationType.fromValue(type) : null;
        NotificationPriority priorityFilter = priority != null ? NotificationPriority.fromValue(priority) : null;

        return ResponseEntity.ok(notificationService.list(hostId, unreadOnly, typeFilter, priorityFilter,
                offset, limit));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Object>> unreadCount(@PathVariable String hostId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("host_id", hostId);
        body.put("unread_count", notificationService.unreadCount(hostId));
        return ResponseEntity.ok(body);
    }

    /**
     * Marks a notification read. Missing and foreign notifications both give 404.
     */
    @PutMapping("/{notificationId}/read")
    public ResponseEntity<Map<String, Object>> markRead(@PathVariable String hostId,
                                                        @PathVariable UUID notificationId) {
        if (!notificationService.markRead(notificationId, hostId)) {
            throw new NotificationNotFoundException(notificationId);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Notification marked as read");
        body.put("notification_id", notificationId);
        return ResponseEntity.ok(body);
    }

    @PutMapping("/read-all")
    public ResponseEntity<Map<String, Object>> markAllRead(@PathVariable String hostId) {
        int updated = notificationService.markAllRead(hostId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "All notifications marked as read");
        body.put("updated_count", updated);
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{notificationId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String hostId,
                                                      @PathVariable UUID notificationId) {
        if (!notificationService.delete(notificationId, hostId)) {
            throw new NotificationNotFoundException(notificationId);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Notification deleted");
        body.put("notification_id", notificationId);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/statistics")
    public ResponseEntity<NotificationStatistics> statistics(@PathVariable String hostId) {
        return ResponseEntity.ok(notificationService.statistics(hostId));
    }

    /**
     * Creates a notification directly. Used by internal producers.
     */
    @PostMapping
    public ResponseEntity<Notification> create(@PathVariable String hostId,
                                               @Valid @RequestBody NotificationRequest request) {
        logger.info("Creating {} notification for host {}", request.getType().getValue(), hostId);

        Notification notification = notificationService.create(NewNotification.builder()
                .hostId(hostId)
                .type(request.getType())
                .title(request.getTitle())
                .message(request.getMessage())
                .priority(request.getPriority() != null ? request.getPriority() : NotificationPriority.MEDIUM)
                .bookingId(request.getBookingId())
                .propertyId(request.getPropertyId())
                .actionRequired(request.isActionRequired())
                .actionUrl(request.getActionUrl())
                .expiresAt(request.getExpiresAt())
                .build());

        return new ResponseEntity<>(notification, HttpStatus.CREATED);
    }

    /**
     * Creates one of the standard booking notifications.
     */
    @PostMapping("/booking")
    public ResponseEntity<Notification> createBookingNotification(
            @PathVariable String hostId,
            @Valid @RequestBody BookingNotificationRequest request) {

        Notification notification = notificationService.createBookingNotification(
                hostId,
                request.getBookingId(),
                request.getPropertyId(),
                request.getKind(),
                request.getGuestName(),
                request.getPropertyTitle());

        return new ResponseEntity<>(notification, HttpStatus.CREATED);
    }
}

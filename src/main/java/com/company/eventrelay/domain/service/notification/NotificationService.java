package com.company.eventrelay.domain.service.notification;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import com.company.eventrelay.domain.model.Notification;
import com.company.eventrelay.domain.repository.NotificationFilter;
import com.company.eventrelay.domain.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Service owning host notifications.
 * Every read and mutation is scoped to the owning host; a notification of another
 * host behaves exactly like a missing one.
 */
@Service
public class NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 100;

    private final NotificationRepository notificationRepository;
    private final long newBookingExpiryHours;

    public NotificationService(
            NotificationRepository notificationRepository,
            @Value("${notifications.expiry.new-booking-hours:72}") long newBookingExpiryHours) {
        this.notificationRepository = notificationRepository;
        this.newBookingExpiryHours = newBookingExpiryHours;
    }

    /**
     * Creates a notification for a host.
     *
     * @param request The notification content
     * @return The persisted notification
     * @throws IllegalArgumentException if the host, type, title or message is missing
     */
    @Transactional
    public Notification create(NewNotification request) {
        requireText(request.getHostId(), "host_id");
        requireText(request.getTitle(), "title");
        requireText(request.getMessage(), "message");
        if (request.getType() == null) {
            throw new IllegalArgumentException("Notification type is required");
        }

        Notification notification = Notification.builder()
                .hostId(request.getHostId())
                .type(request.getType())
                .title(request.getTitle())
                .message(request.getMessage())
                .priority(request.getPriority() != null ? request.getPriority() : NotificationPriority.MEDIUM)
                .bookingId(request.getBookingId())
                .propertyId(request.getPropertyId())
                .actionRequired(request.isActionRequired())
                .actionUrl(request.getActionUrl())
                .isRead(false)
                .expiresAt(request.getExpiresAt())
                .build();

        Notification saved = notificationRepository.save(notification);
        logger.info("Created {} notification {} for host {}", saved.getType().getValue(), saved.getId(),
                saved.getHostId());
        return saved;
    }

    /**
     * Creates one of the standard booking notifications.
     * Only new booking requests expire.
     */
    @Transactional
    public Notification createBookingNotification(String hostId, String bookingId, String propertyId,
                                                  BookingNotificationKind kind, String guestName,
                                                  String propertyTitle) {
        NewNotification request = NewNotification.builder()
                .hostId(hostId)
                .type(kind.getType())
                .title(kind.getTitle())
                .message(kind.formatMessage(guestName, propertyTitle))
                .priority(kind.getPriority())
                .bookingId(bookingId)
                .propertyId(propertyId)
                .actionRequired(kind.isActionRequired())
                .actionUrl(bookingActionUrl(bookingId))
                .expiresAt(kind == BookingNotificationKind.NEW_BOOKING ? newBookingExpiry() : null)
                .build();
        return create(request);
    }

    /**
     * Lists a host's unexpired notifications, newest first.
     *
     * @param limit Page size, clamped to 1..100; null means 50
     * @param offset Number of rows to skip; null or negative means 0
     */
    @Transactional(readOnly = true)
    public NotificationPage list(String hostId, boolean unreadOnly, NotificationType type,
                                 NotificationPriority priority, Integer offset, Integer limit) {
        int effectiveLimit = clampLimit(limit);
        int effectiveOffset = offset == null ? 0 : Math.max(0, offset);
        LocalDateTime now = LocalDateTime.now();

        NotificationFilter filter = NotificationFilter.builder()
                .hostId(hostId)
                .unreadOnly(unreadOnly)
                .type(type)
                .priority(priority)
                .build();

        List<Notification> notifications = notificationRepository.search(filter, now, effectiveOffset, effectiveLimit);
        long total = notificationRepository.count(filter, now);
        long unread = notificationRepository.countUnread(hostId, now);

        return NotificationPage.builder()
                .notifications(notifications)
                .totalCount(total)
                .unreadCount(unread)
                .returnedCount(notifications.size())
                .offset(effectiveOffset)
                .limit(effectiveLimit)
                .hasMore(effectiveOffset + notifications.size() < total)
                .build();
    }

    /**
     * Marks one notification read.
     *
     * @return false if the notification does not exist or belongs to another host
     */
    @Transactional
    public boolean markRead(UUID id, String hostId) {
        boolean updated = notificationRepository.markRead(id, hostId, LocalDateTime.now()) > 0;
        if (!updated) {
            logger.debug("Notification {} not found for host {}", id, hostId);
        }
        return updated;
    }

    /**
     * Marks every unread notification of a host read.
     *
     * @return number of notifications changed
     */
    @Transactional
    public int markAllRead(String hostId) {
        int updated = notificationRepository.markAllRead(hostId, LocalDateTime.now());
        logger.info("Marked {} notification(s) read for host {}", updated, hostId);
        return updated;
    }

    /**
     * Deletes one notification.
     *
     * @return false if the notification does not exist or belongs to another host
     */
    @Transactional
    public boolean delete(UUID id, String hostId) {
        boolean deleted = notificationRepository.deleteOwned(id, hostId) > 0;
        if (deleted) {
            logger.info("Deleted notification {} of host {}", id, hostId);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public long unreadCount(String hostId) {
        return notificationRepository.countUnread(hostId, LocalDateTime.now());
    }

    @Transactional(readOnly = true)
    public NotificationStatistics statistics(String hostId) {
        long total = notificationRepository.countByHostId(hostId);
        long unread = notificationRepository.countByHostIdAndIsRead(hostId, false);
        long read = total - unread;
        long lastWeek = notificationRepository.countByHostIdAndCreatedAtAfter(hostId,
                LocalDateTime.now().minusDays(7));

        Map<String, Long> byType = new LinkedHashMap<>();
        notificationRepository.countByType(hostId)
                .forEach(row -> byType.put(row.getNotificationType().getValue(), row.getTotal()));

        Map<String, Long> byPriority = new LinkedHashMap<>();
        notificationRepository.countByPriority(hostId)
                .forEach(row -> byPriority.put(row.getNotificationPriority().getValue(), row.getTotal()));

        double readPercentage = BigDecimal.valueOf(read * 100.0 / Math.max(total, 1))
                .setScale(1, RoundingMode.HALF_UP)
                .doubleValue();

        return NotificationStatistics.builder()
                .totalNotifications(total)
                .unreadNotifications(unread)
                .readNotifications(read)
                .recentNotifications7d(lastWeek)
                .byType(byType)
                .byPriority(byPriority)
                .readPercentage(readPercentage)
                .build();
    }

    /**
     * Unread, unexpired notifications created at or after {@code since}.
     * Keeps the newest {@code limit} rows and returns them oldest first, in the
     * order they were produced.
     */
    @Transactional(readOnly = true)
    public List<Notification> recentSince(String hostId, LocalDateTime since, int limit) {
        List<Notification> newestFirst = notificationRepository.findRecentUnread(
                hostId, since, LocalDateTime.now(), PageRequest.of(0, Math.max(1, limit)));
        List<Notification> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        return chronological;
    }

    /**
     * Deletes every notification past its expiry.
     *
     * @return number of rows removed
     */
    @Transactional
    public int purgeExpired() {
        int deleted = notificationRepository.deleteExpired(LocalDateTime.now());
        if (deleted > 0) {
            logger.info("Purged {} expired notification(s)", deleted);
        }
        return deleted;
    }

    /**
     * Expiry applied to new booking request notifications.
     */
    public LocalDateTime newBookingExpiry() {
        return LocalDateTime.now().plusHours(newBookingExpiryHours);
    }

    public static String bookingActionUrl(String bookingId) {
        return bookingId == null ? null : "/dashboard/bookings/" + bookingId;
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Field '" + field + "' is required");
        }
    }
}

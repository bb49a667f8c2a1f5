package com.company.eventrelay.infrastructure.scheduler;

import com.company.eventrelay.domain.service.notification.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler that removes expired host notifications.
 */
@Component
public class NotificationPurgeScheduler {

    private static final Logger logger = LoggerFactory.getLogger(NotificationPurgeScheduler.class);

    private final NotificationService notificationService;

    private final AtomicBoolean purgeInProgress = new AtomicBoolean(false);

    private final boolean purgeEnabled;

    public NotificationPurgeScheduler(NotificationService notificationService,
                                      @Value("${scheduler.notification-purge.enabled:true}") boolean purgeEnabled) {
        this.notificationService = notificationService;
        this.purgeEnabled = purgeEnabled;
    }

    /**
     * Deletes notifications whose expiry has passed. Runs hourly by default.
     *
     * @return number of deleted notifications, or -1 when the run was skipped
     */
    @Scheduled(cron = "${scheduler.notification-purge.cron:0 0 * * * *}")
    public int purgeExpiredNotifications() {
        if (!purgeEnabled) {
            logger.debug("Notification purge is disabled");
            return -1;
        }

        if (!purgeInProgress.compareAndSet(false, true)) {
            logger.debug("Skipping notification purge as previous run is still in progress");
            return -1;
        }

        try {
            int deleted = notificationService.purgeExpired();
            logger.debug("Notification purge finished, {} deleted", deleted);
            return deleted;
        } catch (RuntimeException e) {
            logger.error("Error during scheduled notification purge", e);
            return -1;
        } finally {
            purgeInProgress.set(false);
        }
    }
}

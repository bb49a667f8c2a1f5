package com.company.eventrelay.infrastructure.scheduler;

import com.company.eventrelay.domain.service.notification.NotificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationPurgeScheduler Unit Tests")
class NotificationPurgeSchedulerTest {

    @Mock
    private NotificationService notificationService;

    @Test
    @DisplayName("Should purge expired notifications")
    void shouldPurge() {
        when(notificationService.purgeExpired()).thenReturn(4);

        int deleted = new NotificationPurgeScheduler(notificationService, true).purgeExpiredNotifications();

        assertThat(deleted).isEqualTo(4);
    }

    @Test
    @DisplayName("Should do nothing when disabled")
    void shouldSkipWhenDisabled() {
        int deleted = new NotificationPurgeScheduler(notificationService, false).purgeExpiredNotifications();

        assertThat(deleted).isEqualTo(-1);
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Should log and survive a failing purge")
    void shouldSurviveFailure() {
        NotificationPurgeScheduler scheduler = new NotificationPurgeScheduler(notificationService, true);
        when(notificationService.purgeExpired())
                .thenThrow(new DataAccessResourceFailureException("database down"))
                .thenReturn(0);

        assertThat(scheduler.purgeExpiredNotifications()).isEqualTo(-1);
        assertThat(scheduler.purgeExpiredNotifications()).isZero();
    }
}

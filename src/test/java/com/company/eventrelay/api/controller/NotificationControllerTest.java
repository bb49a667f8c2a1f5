package com.company.eventrelay.api.controller;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import com.company.eventrelay.domain.model.Notification;
import com.company.eventrelay.domain.service.notification.BookingNotificationKind;
import com.company.eventrelay.domain.service.notification.NewNotification;
import com.company.eventrelay.domain.service.notification.NotificationPage;
import com.company.eventrelay.domain.service.notification.NotificationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = NotificationController.class)
@DisplayName("NotificationController Tests")
class NotificationControllerTest {

    private static final String HOST = "host-1";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationService notificationService;

    private static Notification notification(UUID id) {
        return Notification.builder()
                .id(id)
                .hostId(HOST)
                .type(NotificationType.NEW_BOOKING)
                .title("New Booking Request")
                .message("You have a new booking request from Ana for Loft")
                .priority(NotificationPriority.HIGH)
                .bookingId("B1")
                .actionRequired(true)
                .actionUrl("/bookings/B1")
                .createdAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("Should list notifications with snake_case query parameters")
    void shouldList() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        NotificationPage page = NotificationPage.builder()
                .notifications(Collections.singletonList(notification(id)))
                .totalCount(1).unreadCount(1).returnedCount(1).offset(0).limit(10).hasMore(false)
                .build();
        when(notificationService.list(HOST, true, NotificationType.NEW_BOOKING, NotificationPriority.HIGH, 0, 10))
                .thenReturn(page);

        // When / Then
        mockMvc.perform(get("/api/v1/hosts/{hostId}/notifications", HOST)
                        .param("unread_only", "true")
                        .param("limit", "10")
                        .param("offset", "0")
                        .param("type", "new_booking")
                        .param("priority", "high"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(1))
                .andExpect(jsonPath("$.has_more").value(false))
                .andExpect(jsonPath("$.notifications[0].id").value(id.toString()))
                .andExpect(jsonPath("$.notifications[0].type").value("new_booking"))
                .andExpect(jsonPath("$.notifications[0].priority").value("high"))
                .andExpect(jsonPath("$.notifications[0].is_read").value(false));
    }

    @Test
    @DisplayName("Should pass absent paging parameters through as null")
    void shouldUseDefaults() throws Exception {
        when(notificationService.list(HOST, false, null, null, null, null))
                .thenReturn(NotificationPage.builder().notifications(Collections.emptyList())
                        .limit(NotificationService.DEFAULT_LIMIT).build());

        mockMvc.perform(get("/api/v1/hosts/{hostId}/notifications", HOST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.limit").value(50));
    }

    @Test
    @DisplayName("Should answer 400 for an unknown type filter")
    void shouldRejectUnknownType() throws Exception {
        mockMvc.perform(get("/api/v1/hosts/{hostId}/notifications", HOST).param("type", "fire"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));

        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Should return the unread count")
    void shouldCount() throws Exception {
        when(notificationService.unreadCount(HOST)).thenReturn(3L);

        mockMvc.perform(get("/api/v1/hosts/{hostId}/notifications/count", HOST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.host_id").value(HOST))
                .andExpect(jsonPath("$.unread_count").value(3));
    }

    @Test
    @DisplayName("Should mark an owned notification read")
    void shouldMarkRead() throws Exception {
        UUID id = UUID.randomUUID();
        when(notificationService.markRead(id, HOST)).thenReturn(true);

        mockMvc.perform(put("/api/v1/hosts/{hostId}/notifications/{id}/read", HOST, id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.notification_id").value(id.toString()));
    }

    @Test
    @DisplayName("Should answer 404 when marking a foreign notification read")
    void shouldNotMarkForeign() throws Exception {
        UUID id = UUID.randomUUID();
        when(notificationService.markRead(id, HOST)).thenReturn(false);

        mockMvc.perform(put("/api/v1/hosts/{hostId}/notifications/{id}/read", HOST, id))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should report how many notifications were marked read")
    void shouldMarkAllRead() throws Exception {
        when(notificationService.markAllRead(HOST)).thenReturn(4);

        mockMvc.perform(put("/api/v1/hosts/{hostId}/notifications/read-all", HOST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_count").value(4));
    }

    @Test
    @DisplayName("Should answer 404 when deleting an unknown notification")
    void shouldNotDeleteUnknown() throws Exception {
        UUID id = UUID.randomUUID();
        when(notificationService.delete(id, HOST)).thenReturn(false);

        mockMvc.perform(delete("/api/v1/hosts/{hostId}/notifications/{id}", HOST, id))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should create a notification with medium priority by default")
    void shouldCreate() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        when(notificationService.create(any(NewNotification.class))).thenReturn(notification(id));

        // When
        mockMvc.perform(post("/api/v1/hosts/{hostId}/notifications", HOST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"guest_message\",\"title\":\"Hi\",\"message\":\"Question\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()));

        // Then
        ArgumentCaptor<NewNotification> captor = ArgumentCaptor.forClass(NewNotification.class);
        verify(notificationService).create(captor.capture());
        assertThat(captor.getValue().getHostId()).isEqualTo(HOST);
        assertThat(captor.getValue().getType()).isEqualTo(NotificationType.GUEST_MESSAGE);
        assertThat(captor.getValue().getPriority()).isEqualTo(NotificationPriority.MEDIUM);
    }

    @Test
    @DisplayName("Should answer 400 for an unknown notification type in the body")
    void shouldRejectUnknownBodyType() throws Exception {
        mockMvc.perform(post("/api/v1/hosts/{hostId}/notifications", HOST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"fire\",\"title\":\"Hi\",\"message\":\"Question\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("Should create a standard booking notification")
    void shouldCreateBookingNotification() throws Exception {
        UUID id = UUID.randomUUID();
        when(notificationService.createBookingNotification(eq(HOST), eq("B1"), eq("P1"),
                eq(BookingNotificationKind.NEW_BOOKING), eq("Ana"), eq("Loft")))
                .thenReturn(notification(id));

        mockMvc.perform(post("/api/v1/hosts/{hostId}/notifications/booking", HOST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"booking_id\":\"B1\",\"property_id\":\"P1\",\"kind\":\"new_booking\","
                                + "\"guest_name\":\"Ana\",\"property_title\":\"Loft\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.action_required").value(true));
    }

    @Test
    @DisplayName("Should answer 400 when the booking notification misses fields")
    void shouldRejectIncompleteBookingNotification() throws Exception {
        mockMvc.perform(post("/api/v1/hosts/{hostId}/notifications/booking", HOST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"booking_id\":\"B1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors").exists());

        verifyNoInteractions(notificationService);
    }
}

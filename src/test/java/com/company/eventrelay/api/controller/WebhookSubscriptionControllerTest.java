package com.company.eventrelay.api.controller;

import com.company.eventrelay.api.exception.SubscriptionNotFoundException;
import com.company.eventrelay.api.exception.SubscriptionValidationException;
import com.company.eventrelay.domain.enums.WebhookEventType;
import com.company.eventrelay.domain.model.WebhookSubscription;
import com.company.eventrelay.domain.service.webhook.DeliveryReport;
import com.company.eventrelay.domain.service.webhook.SubscriberOutcome;
import com.company.eventrelay.domain.service.webhook.SubscriptionRegistry;
import com.company.eventrelay.domain.service.webhook.SubscriptionStatistics;
import com.company.eventrelay.domain.service.webhook.WebhookDeliveryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = WebhookSubscriptionController.class)
@DisplayName("WebhookSubscriptionController Tests")
class WebhookSubscriptionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SubscriptionRegistry subscriptionRegistry;

    @MockBean
    private WebhookDeliveryService deliveryService;

    private static WebhookSubscription subscription(UUID id, boolean active, int failedAttempts) {
        return WebhookSubscription.builder()
                .id(id)
                .agentName("TestAgent")
                .webhookUrl("https://example.test/hook")
                .events(new HashSet<>(Collections.singletonList("booking.created")))
                .sharedSecret("s3cr3t")
                .isActive(active)
                .failedAttempts(failedAttempts)
                .maxFailedAttempts(5)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
    }

    @Test
    @DisplayName("Should register a subscription and omit the secret")
    void shouldRegister() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        when(subscriptionRegistry.register(eq("TestAgent"), eq("https://example.test/hook"),
                eq(Collections.singletonList("booking.created")), eq("s3cr3t"), isNull()))
                .thenReturn(subscription(id, true, 0));

        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_name\":\"TestAgent\",\"webhook_url\":\"https://example.test/hook\","
                                + "\"events\":[\"booking.created\"],\"secret_key\":\"s3cr3t\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(id.toString()))
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.failed_attempts").value(0))
                .andExpect(jsonPath("$.events[0]").value("booking.created"))
                .andExpect(jsonPath("$.secret_key").doesNotExist())
                .andExpect(jsonPath("$.shared_secret").doesNotExist());
    }

    @Test
    @DisplayName("Should answer 400 with the offending events")
    void shouldRejectUnknownEvents() throws Exception {
        // Given
        Map<String, Object> errors = new LinkedHashMap<>();
        errors.put("invalid_events", Collections.singletonList("booking.exploded"));
        errors.put("valid_events", WebhookEventType.allValues());
        when(subscriptionRegistry.register(any(), any(), any(), any(), any()))
                .thenThrow(new SubscriptionValidationException("Invalid subscription request", errors));

        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_name\":\"TestAgent\",\"webhook_url\":\"https://example.test/hook\","
                                + "\"events\":[\"booking.exploded\"],\"secret_key\":\"s3cr3t\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.path").value("/api/v1/subscriptions"))
                .andExpect(jsonPath("$.details.invalid_events[0]").value("booking.exploded"))
                .andExpect(jsonPath("$.details.valid_events", hasItem("payment.received")));
    }

    @Test
    @DisplayName("Should answer 400 when required fields are missing")
    void shouldRejectMissingFields() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_name\":\"TestAgent\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.errors.webhookUrl").exists());

        verifyNoInteractions(subscriptionRegistry);
    }

    @Test
    @DisplayName("Should answer 400 for a malformed body")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/subscriptions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed Request"));
    }

    @Test
    @DisplayName("Should list subscriptions")
    void shouldList() throws Exception {
        when(subscriptionRegistry.listAll()).thenReturn(Arrays.asList(
                subscription(UUID.randomUUID(), true, 0),
                subscription(UUID.randomUUID(), false, 5)));

        mockMvc.perform(get("/api/v1/subscriptions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].is_active").value(false));
    }

    @Test
    @DisplayName("Should answer 404 for an unknown subscription")
    void shouldReturnNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(subscriptionRegistry.get(id)).thenThrow(new SubscriptionNotFoundException(id));

        mockMvc.perform(get("/api/v1/subscriptions/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("Should update a subscription")
    void shouldUpdate() throws Exception {
        UUID id = UUID.randomUUID();
        when(subscriptionRegistry.update(eq(id), isNull(), eq("https://new.test/hook"), isNull(), isNull()))
                .thenReturn(subscription(id, true, 0));

        mockMvc.perform(put("/api/v1/subscriptions/{id}", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"webhook_url\":\"https://new.test/hook\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(id.toString()));
    }

    @Test
    @DisplayName("Should always answer 200 on delete")
    void shouldDelete() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/subscriptions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subscription_id").value(id.toString()));

        verify(subscriptionRegistry).delete(id);
    }

    @Test
    @DisplayName("Should report previous and new status on toggle")
    void shouldToggle() throws Exception {
        UUID id = UUID.randomUUID();
        when(subscriptionRegistry.toggle(id)).thenReturn(subscription(id, true, 0));

        mockMvc.perform(post("/api/v1/subscriptions/{id}/toggle", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previous_status").value("inactive"))
                .andExpect(jsonPath("$.new_status").value("active"))
                .andExpect(jsonPath("$.failed_attempts").value(0));
    }

    @Test
    @DisplayName("Should test one subscription and return the report")
    void shouldTestSubscription() throws Exception {
        // Given
        UUID id = UUID.randomUUID();
        SubscriberOutcome outcome = SubscriberOutcome.builder()
                .subscriptionId(id).agentName("TestAgent").delivered(true).attempts(1).statusCode(200).build();
        when(deliveryService.deliverTestEvent(eq(id), isNull()))
                .thenReturn(DeliveryReport.of("test.webhook", Collections.singletonList(outcome)));

        // When / Then
        mockMvc.perform(post("/api/v1/subscriptions/{id}/test", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event_type").value("test.webhook"))
                .andExpect(jsonPath("$.status").value("DELIVERED"))
                .andExpect(jsonPath("$.outcomes[0].status_code").value(200));
    }

    @Test
    @DisplayName("Should run a manual delivery cycle")
    void shouldRunTestDelivery() throws Exception {
        when(deliveryService.deliverEvent(eq("payment.received"), anyMap()))
                .thenReturn(DeliveryReport.noSubscribers("payment.received"));

        mockMvc.perform(post("/api/v1/webhooks/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_type\":\"payment.received\",\"data\":{\"booking_id\":\"B1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("NO_SUBSCRIBERS"))
                .andExpect(jsonPath("$.total_subscribers").value(0));
    }

    @Test
    @DisplayName("Should reject a manual delivery of an unknown event")
    void shouldRejectUnknownTestEvent() throws Exception {
        mockMvc.perform(post("/api/v1/webhooks/test")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event_type\":\"nope\",\"data\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(deliveryService);
    }

    @Test
    @DisplayName("Should expose subscription statistics")
    void shouldReturnStatistics() throws Exception {
        when(subscriptionRegistry.statistics()).thenReturn(SubscriptionStatistics.builder()
                .totalSubscriptions(4).activeSubscriptions(3).inactiveSubscriptions(1)
                .recentSuccessfulCalls24h(2).successRate(66.67).build());

        mockMvc.perform(get("/api/v1/webhooks/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_subscriptions").value(3))
                .andExpect(jsonPath("$.recent_successful_calls_24h").value(2))
                .andExpect(jsonPath("$.success_rate").value(66.67));
    }
}

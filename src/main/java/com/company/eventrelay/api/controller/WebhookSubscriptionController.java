package com.company.eventrelay.api.controller;

import com.company.eventrelay.api.dto.SubscriptionRequest;
import com.company.eventrelay.api.dto.SubscriptionResponse;
import com.company.eventrelay.api.dto.SubscriptionUpdateRequest;
import com.company.eventrelay.api.dto.ToggleResponse;
import com.company.eventrelay.api.dto.WebhookTestRequest;
import com.company.eventrelay.domain.enums.WebhookEventType;
import com.company.eventrelay.domain.model.WebhookSubscription;
import com.company.eventrelay.domain.service.webhook.DeliveryReport;
import com.company.eventrelay.domain.service.webhook.SubscriptionRegistry;
import com.company.eventrelay.domain.service.webhook.SubscriptionStatistics;
import com.company.eventrelay.domain.service.webhook.WebhookDeliveryService;
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
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST Controller for managing webhook subscriptions of external agents
 * and for manually testing deliveries.
 */
@RestController
@RequestMapping("/api/v1")
public class WebhookSubscriptionController {

    private static final Logger logger = LoggerFactory.getLogger(WebhookSubscriptionController.class);

    private final SubscriptionRegistry subscriptionRegistry;
    private final WebhookDeliveryService deliveryService;

    public WebhookSubscriptionController(SubscriptionRegistry subscriptionRegistry,
                                         WebhookDeliveryService deliveryService) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.deliveryService = deliveryService;
    }

    /**
     * Registers a new subscription.
     *
     * @param request Subscription details
     * @return The created subscription, without its secret
     */
    @PostMapping("/subscriptions")
    public ResponseEntity<SubscriptionResponse> register(@Valid @RequestBody SubscriptionRequest request) {
        logger.info("Registering webhook subscription for agent: {}", request.getAgentName());

        WebhookSubscription subscription = subscriptionRegistry.register(
                request.getAgentName(),
                request.getWebhookUrl(),
                request.getEvents(),
                request.getSecretKey(),
                request.getMaxFailedAttempts());

        return new ResponseEntity<>(SubscriptionResponse.from(subscription), HttpStatus.CREATED);
    }

    @GetMapping("/subscriptions")
    public ResponseEntity<List<SubscriptionResponse>> list() {
        List<SubscriptionResponse> subscriptions = subscriptionRegistry.listAll().stream()
                .map(SubscriptionResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(subscriptions);
    }

    @GetMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<SubscriptionResponse> get(@PathVariable UUID subscriptionId) {
        return ResponseEntity.ok(SubscriptionResponse.from(subscriptionRegistry.get(subscriptionId)));
    }

    @PutMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<SubscriptionResponse> update(@PathVariable UUID subscriptionId,
                                                       @RequestBody SubscriptionUpdateRequest request) {
        logger.info("Updating webhook subscription: {}", subscriptionId);

        WebhookSubscription subscription = subscriptionRegistry.update(
                subscriptionId,
                request.getAgentName(),
                request.getWebhookUrl(),
                request.getEvents(),
                request.getSecretKey());

        return ResponseEntity.ok(SubscriptionResponse.from(subscription));
    }

    /**
     * Deletes a subscription. Always succeeds, also for unknown ids.
     */
    @DeleteMapping("/subscriptions/{subscriptionId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable UUID subscriptionId) {
        logger.info("Deleting webhook subscription: {}", subscriptionId);

        subscriptionRegistry.delete(subscriptionId);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Subscription deleted");
        body.put("subscription_id", subscriptionId);
        return ResponseEntity.ok(body);
    }

    /**
     * Flips the active flag. Reactivation starts the failure count over.
     */
    @PostMapping("/subscriptions/{subscriptionId}/toggle")
    public ResponseEntity<ToggleResponse> toggle(@PathVariable UUID subscriptionId) {
        WebhookSubscription updated = subscriptionRegistry.toggle(subscriptionId);
        boolean active = Boolean.TRUE.equals(updated.getIsActive());

        ToggleResponse response = ToggleResponse.builder()
                .subscriptionId(subscriptionId)
                .previousStatus(ToggleResponse.statusLabel(!active))
                .newStatus(ToggleResponse.statusLabel(active))
                .failedAttempts(updated.getFailedAttempts())
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Sends a {@code test.webhook} event to one subscription and reports the outcome.
     */
    @PostMapping("/subscriptions/{subscriptionId}/test")
    public ResponseEntity<DeliveryReport> testSubscription(
            @PathVariable UUID subscriptionId,
            @RequestBody(required = false) Map<String, Object> data) {

        logger.info("Testing webhook subscription: {}", subscriptionId);
        return ResponseEntity.ok(deliveryService.deliverTestEvent(subscriptionId, data));
    }

    /**
     * Runs one synchronous delivery cycle against every matching active subscription.
     * Meant for manual verification, not production traffic.
     */
    @PostMapping("/webhooks/test")
    public ResponseEntity<DeliveryReport> testDelivery(@Valid @RequestBody WebhookTestRequest request) {
        if (!WebhookEventType.isValid(request.getEventType())) {
            throw new IllegalArgumentException("Unknown event type '" + request.getEventType()
                    + "'. Must be one of: " + WebhookEventType.allValues());
        }

        logger.info("Running test delivery of event {}", request.getEventType());
        return ResponseEntity.ok(deliveryService.deliverEvent(request.getEventType(), request.getData()));
    }

    @GetMapping("/webhooks/statistics")
    public ResponseEntity<SubscriptionStatistics> statistics() {
        return ResponseEntity.ok(subscriptionRegistry.statistics());
    }
}

package com.company.eventrelay.domain.service.webhook;

import com.company.eventrelay.domain.enums.AttemptOutcome;
import com.company.eventrelay.domain.enums.WebhookEventType;
import com.company.eventrelay.domain.model.WebhookSubscription;
import com.company.eventrelay.infrastructure.http.WebhookClient;
import com.company.eventrelay.infrastructure.http.WebhookClient.WebhookResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Implementation of the WebhookDeliveryService interface.
 * Fans an event out to its subscribers on the webhook executor, signs each payload,
 * retries failed calls with exponential backoff and records one success or one
 * failure per delivery in the registry.
 */
@Service
public class WebhookDeliveryServiceImpl implements WebhookDeliveryService {

    private static final Logger logger = LoggerFactory.getLogger(WebhookDeliveryServiceImpl.class);

    static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    static final String EVENT_HEADER = "X-Webhook-Event";
    static final String DELIVERY_ID_HEADER = "X-Webhook-ID";
    static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    static final String USER_AGENT = "HostEventRelay-Webhook/1.0";

    private final SubscriptionRegistry subscriptionRegistry;
    private final WebhookSigner signer;
    private final WebhookClient webhookClient;
    private final RetryBackoffPolicy backoffPolicy;
    private final ObjectMapper objectMapper;
    private final Executor webhookExecutor;
    private final int maxAttempts;

    public WebhookDeliveryServiceImpl(
            SubscriptionRegistry subscriptionRegistry,
            WebhookSigner signer,
            WebhookClient webhookClient,
            RetryBackoffPolicy backoffPolicy,
            ObjectMapper objectMapper,
            @Qualifier("webhookExecutor") Executor webhookExecutor,
            @Value("${webhook.delivery.max-attempts:3}") int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("webhook.delivery.max-attempts must be >= 1, got: " + maxAttempts);
        }
        this.subscriptionRegistry = subscriptionRegistry;
        this.signer = signer;
        this.webhookClient = webhookClient;
        this.backoffPolicy = backoffPolicy;
        this.objectMapper = objectMapper;
        this.webhookExecutor = webhookExecutor;
        this.maxAttempts = maxAttempts;
    }

    @Override
    public DeliveryReport deliverEvent(String eventType, Map<String, Object> data) {
        List<WebhookSubscription> subscriptions = subscriptionRegistry.findActiveForEvent(eventType);
        if (subscriptions.isEmpty()) {
            logger.debug("No active subscriptions for event {}", eventType);
            return DeliveryReport.noSubscribers(eventType);
        }

        byte[] body = serializeEnvelope(eventType, data);
        logger.info("Delivering event {} to {} subscription(s)", eventType, subscriptions.size());

        List<CompletableFuture<SubscriberOutcome>> futures = subscriptions.stream()
                .map(subscription -> CompletableFuture.supplyAsync(
                        () -> deliverSafely(subscription, eventType, body), webhookExecutor))
                .collect(Collectors.toList());

        List<SubscriberOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        DeliveryReport report = DeliveryReport.of(eventType, outcomes);
        logger.info("Event {} delivery finished with status {} ({} of {} delivered)",
                eventType, report.getStatus(), report.getSuccessful(), report.getTotalSubscribers());
        return report;
    }

    @Override
    public DeliveryReport deliverTestEvent(UUID subscriptionId, Map<String, Object> data) {
        WebhookSubscription subscription = subscriptionRegistry.get(subscriptionId);
        String eventType = WebhookEventType.TEST.getValue();

        Map<String, Object> testData = data != null ? data : Collections.singletonMap(
                "message", "This is a test webhook from the host event relay");
        byte[] body = serializeEnvelope(eventType, testData);

        logger.info("Sending test webhook to subscription {}", subscriptionId);
        SubscriberOutcome outcome = deliverSafely(subscription, eventType, body);
        return DeliveryReport.of(eventType, Collections.singletonList(outcome));
    }

    /**
     * Runs one delivery and turns any unexpected error into a failed outcome,
     * so one subscriber can never break the fan-out for the others.
     */
    private SubscriberOutcome deliverSafely(WebhookSubscription subscription, String eventType, byte[] body) {
        try {
            return deliver(subscription, eventType, body);
        } catch (RuntimeException e) {
            logger.error("Unexpected error delivering event {} to subscription {}",
                    eventType, subscription.getId(), e);
            return SubscriberOutcome.builder()
                    .subscriptionId(subscription.getId())
                    .agentName(subscription.getAgentName())
                    .delivered(false)
                    .error(e.getMessage())
                    .build();
        }
    }

    private SubscriberOutcome deliver(WebhookSubscription subscription, String eventType, byte[] body) {
        UUID subscriptionId = subscription.getId();
        HttpHeaders headers = buildHeaders(subscription, eventType, body);

        SubscriberOutcome.SubscriberOutcomeBuilder outcome = SubscriberOutcome.builder()
                .subscriptionId(subscriptionId)
                .agentName(subscription.getAgentName());

        long totalDuration = 0;
        DeliveryAttempt attempt = null;
        int attemptNumber = 0;

        while (attemptNumber < maxAttempts) {
            attemptNumber++;
            attempt = attempt(subscription.getWebhookUrl(), body, headers);
            totalDuration += attempt.getDurationMs();

            if (attempt.getOutcome() == AttemptOutcome.SUCCESS) {
                logger.info("Event {} delivered to subscription {} on attempt {} (HTTP {})",
                        eventType, subscriptionId, attemptNumber, attempt.getStatusCode());
                subscriptionRegistry.recordSuccess(subscriptionId);
                return outcome.delivered(true)
                        .attempts(attemptNumber)
                        .statusCode(attempt.getStatusCode())
                        .durationMs(totalDuration)
                        .build();
            }

            logger.warn("Event {} delivery to subscription {} failed on attempt {}/{}: {}",
                    eventType, subscriptionId, attemptNumber, maxAttempts, attempt.getError());

            if (!attempt.getOutcome().isRetryable() || attemptNumber >= maxAttempts) {
                break;
            }

            long delayMs = backoffPolicy.delayAfterAttempt(attemptNumber);
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Delivery of event {} to subscription {} interrupted after attempt {}, "
                        + "failure not recorded", eventType, subscriptionId, attemptNumber);
                return outcome.delivered(false)
                        .attempts(attemptNumber)
                        .statusCode(attempt.getStatusCode())
                        .error(attempt.getError())
                        .durationMs(totalDuration)
                        .aborted(true)
                        .build();
            }
        }

        boolean deactivated = subscriptionRegistry.recordFailure(subscriptionId);
        logger.error("Event {} delivery to subscription {} failed after {} attempt(s)",
                eventType, subscriptionId, attemptNumber);

        return outcome.delivered(false)
                .attempts(attemptNumber)
                .statusCode(attempt.getStatusCode())
                .error(attempt.getError())
                .durationMs(totalDuration)
                .deactivated(deactivated)
                .build();
    }

    /**
     * Performs one HTTP call and classifies its result.
     */
    private DeliveryAttempt attempt(String url, byte[] body, HttpHeaders headers) {
        long start = System.currentTimeMillis();
        try {
            WebhookResponse response = webhookClient.sendWebhook(url, body, headers);
            if (response.isSuccess()) {
                return DeliveryAttempt.success(response.getStatusCode(), response.getDurationMs());
            }
            return DeliveryAttempt.rejected(response.getStatusCode(), response.getDurationMs());
        } catch (IllegalArgumentException e) {
            return DeliveryAttempt.permanentFailure("Invalid webhook URL: " + e.getMessage());
        } catch (RestClientException e) {
            return DeliveryAttempt.transportFailure(e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    private HttpHeaders buildHeaders(WebhookSubscription subscription, String eventType, byte[] body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(SIGNATURE_HEADER, signer.sign(subscription.getSharedSecret(), body));
        headers.set(EVENT_HEADER, eventType);
        headers.set(DELIVERY_ID_HEADER, UUID.randomUUID().toString());
        headers.set(TIMESTAMP_HEADER, String.valueOf(Instant.now().getEpochSecond()));
        headers.set(HttpHeaders.USER_AGENT, USER_AGENT);
        return headers;
    }

    /**
     * Serializes the envelope once; the same bytes are signed and sent to every subscriber.
     */
    private byte[] serializeEnvelope(String eventType, Map<String, Object> data) {
        WebhookEnvelope envelope = new WebhookEnvelope(
                eventType,
                Instant.now().toString(),
                data != null ? data : Collections.emptyMap());
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event data for " + eventType + " cannot be serialized", e);
        }
    }
}

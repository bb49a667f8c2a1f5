package com.company.eventrelay.domain.service.webhook;

import com.company.eventrelay.api.exception.SubscriptionNotFoundException;
import com.company.eventrelay.api.exception.SubscriptionValidationException;
import com.company.eventrelay.domain.enums.WebhookEventType;
import com.company.eventrelay.domain.model.WebhookSubscription;
import com.company.eventrelay.domain.repository.WebhookSubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Service owning the catalog of external webhook subscribers.
 * Provides registration and management operations, the per-event lookup used by
 * the delivery engine, and the only code paths that change subscription health.
 */
@Service
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final WebhookSubscriptionRepository subscriptionRepository;
    private final int defaultMaxFailedAttempts;
    private final int minSecretLength;

    public SubscriptionRegistry(
            WebhookSubscriptionRepository subscriptionRepository,
            @Value("${webhook.subscription.default-max-failed-attempts:5}") int defaultMaxFailedAttempts,
            @Value("${webhook.subscription.min-secret-length:6}") int minSecretLength) {
        this.subscriptionRepository = subscriptionRepository;
        this.defaultMaxFailedAttempts = defaultMaxFailedAttempts;
        this.minSecretLength = minSecretLength;
    }

    /**
     * Registers a new subscriber with the default failure threshold.
     *
     * @see #register(String, String, Collection, String, Integer)
     */
    @Transactional
    public WebhookSubscription register(String agentName, String webhookUrl,
                                        Collection<String> events, String sharedSecret) {
        return register(agentName, webhookUrl, events, sharedSecret, null);
    }

    /**
     * Registers a new subscriber. The subscription starts active with a zeroed failure counter.
     *
     * @param agentName Display label of the subscriber
     * @param webhookUrl Endpoint receiving the callbacks
     * @param events Event types to subscribe to, a non-empty subset of the vocabulary
     * @param sharedSecret Key used to sign payloads
     * @param maxFailedAttempts Failure threshold, or null for the configured default
     * @return The persisted subscription
     * @throws SubscriptionValidationException listing every offending field
     */
    @Transactional
    public WebhookSubscription register(String agentName, String webhookUrl, Collection<String> events,
                                        String sharedSecret, Integer maxFailedAttempts) {
        Map<String, Object> errors = new LinkedHashMap<>();
        validateAgentName(agentName, errors);
        validateUrl(webhookUrl, errors);
        validateEvents(events, errors);
        validateSecret(sharedSecret, errors);
        validateThreshold(maxFailedAttempts, errors);
        throwIfInvalid(errors);

        WebhookSubscription subscription = WebhookSubscription.builder()
                .agentName(agentName.trim())
                .webhookUrl(webhookUrl.trim())
                .events(new LinkedHashSet<>(events))
                .sharedSecret(sharedSecret)
                .isActive(true)
                .failedAttempts(0)
                .maxFailedAttempts(maxFailedAttempts != null ? maxFailedAttempts : defaultMaxFailedAttempts)
                .build();

        WebhookSubscription saved = subscriptionRepository.save(subscription);
        logger.info("Registered webhook subscription {} for agent '{}' with events {}",
                saved.getId(), saved.getAgentName(), saved.getEvents());
        return saved;
    }

    /**
     * Updates the mutable fields of a subscription. Null arguments keep the current value.
     * Health fields are not touched here.
     */
    @Transactional
    public WebhookSubscription update(UUID id, String agentName, String webhookUrl,
                                      Collection<String> events, String sharedSecret) {
        WebhookSubscription subscription = get(id);

        Map<String, Object> errors = new LinkedHashMap<>();
        if (agentName != null) {
            validateAgentName(agentName, errors);
        }
        if (webhookUrl != null) {
            validateUrl(webhookUrl, errors);
        }
        if (events != null) {
            validateEvents(events, errors);
        }
        if (sharedSecret != null) {
            validateSecret(sharedSecret, errors);
        }
        throwIfInvalid(errors);

        if (agentName != null) {
            subscription.setAgentName(agentName.trim());
        }
        if (webhookUrl != null) {
            subscription.setWebhookUrl(webhookUrl.trim());
        }
        if (events != null) {
            subscription.getEvents().clear();
            subscription.getEvents().addAll(events);
        }
        if (sharedSecret != null) {
            subscription.setSharedSecret(sharedSecret);
        }

        logger.info("Updating webhook subscription {}", id);
        return subscriptionRepository.save(subscription);
    }

    @Transactional(readOnly = true)
    public List<WebhookSubscription> listAll() {
        return subscriptionRepository.findAll();
    }

    /**
     * Gets a subscription by its ID.
     *
     * @throws SubscriptionNotFoundException if no such subscription exists
     */
    @Transactional(readOnly = true)
    public WebhookSubscription get(UUID id) {
        return subscriptionRepository.findById(id)
                .orElseThrow(() -> new SubscriptionNotFoundException(id));
    }

    /**
     * Hard-removes a subscription. Deleting an unknown id is a no-op.
     */
    @Transactional
    public void delete(UUID id) {
        if (!subscriptionRepository.existsById(id)) {
            logger.debug("Subscription {} already absent, nothing to delete", id);
            return;
        }
        try {
            subscriptionRepository.deleteById(id);
            logger.info("Deleted webhook subscription {}", id);
        } catch (EmptyResultDataAccessException e) {
            logger.debug("Subscription {} was deleted concurrently", id);
        }
    }

    /**
     * Hot lookup path, invoked once per dispatched event.
     */
    @Transactional(readOnly = true)
    public List<WebhookSubscription> findActiveForEvent(String eventType) {
        return subscriptionRepository.findActiveByEventType(eventType);
    }

    /**
     * Activates or deactivates a subscription explicitly. Activating resets the failure counter.
     *
     * @return The subscription after the change
     */
    @Transactional
    public WebhookSubscription setActive(UUID id, boolean active) {
        LocalDateTime now = LocalDateTime.now();
        int updated = active
                ? subscriptionRepository.activate(id, now)
                : subscriptionRepository.deactivate(id, now);
        if (updated == 0) {
            throw new SubscriptionNotFoundException(id);
        }

        logger.info("{} webhook subscription {}", active ? "Activated" : "Deactivated", id);
        return get(id);
    }

    /**
     * Flips the active flag of a subscription.
     *
     * @return The subscription after the change
     */
    @Transactional
    public WebhookSubscription toggle(UUID id) {
        WebhookSubscription current = get(id);
        return setActive(id, !Boolean.TRUE.equals(current.getIsActive()));
    }

    /**
     * Records an acknowledged delivery in a single update.
     */
    @Transactional
    public void recordSuccess(UUID id) {
        int updated = subscriptionRepository.markSuccess(id, LocalDateTime.now());
        if (updated == 0) {
            logger.debug("Subscription {} no longer exists, success not recorded", id);
        }
    }

    /**
     * Records one exhausted delivery. The increment locks the row, so the threshold
     * check that follows in the same transaction sees the post-increment value.
     *
     * @return true if this failure switched the subscription off
     */
    @Transactional
    public boolean recordFailure(UUID id) {
        LocalDateTime now = LocalDateTime.now();
        if (subscriptionRepository.incrementFailedAttempts(id, now) == 0) {
            logger.debug("Subscription {} no longer exists, failure not recorded", id);
            return false;
        }

        boolean deactivated = subscriptionRepository.deactivateIfThresholdReached(id, now) > 0;
        if (deactivated) {
            logger.warn("Webhook subscription {} deactivated after reaching its failure threshold", id);
        }
        return deactivated;
    }

    @Transactional(readOnly = true)
    public SubscriptionStatistics statistics() {
        long total = subscriptionRepository.count();
        long active = subscriptionRepository.countByIsActive(true);
        long recent = subscriptionRepository.countByLastSuccessfulCallAfter(LocalDateTime.now().minusHours(24));

        double successRate = BigDecimal.valueOf(recent * 100.0 / Math.max(active, 1))
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();

        return SubscriptionStatistics.builder()
                .totalSubscriptions(total)
                .activeSubscriptions(active)
                .inactiveSubscriptions(total - active)
                .recentSuccessfulCalls24h(recent)
                .successRate(successRate)
                .build();
    }

    private void validateAgentName(String agentName, Map<String, Object> errors) {
        if (agentName == null || agentName.trim().isEmpty()) {
            errors.put("agent_name", "Agent name is required");
        }
    }

    private void validateUrl(String url, Map<String, Object> errors) {
        if (url == null || url.trim().isEmpty()) {
            errors.put("webhook_url", "Webhook URL is required");
            return;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null
                    || !(scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase("http"))
                    || uri.getHost() == null) {
                errors.put("webhook_url", "Webhook URL must be an absolute http(s) URL: " + url);
            }
        } catch (URISyntaxException e) {
            errors.put("webhook_url", "Webhook URL is malformed: " + e.getReason());
        }
    }

    private void validateEvents(Collection<String> events, Map<String, Object> errors) {
        if (events == null || events.isEmpty()) {
            errors.put("events", "At least one event type must be specified");
            errors.put("valid_events", WebhookEventType.allValues());
            return;
        }
        List<String> invalid = new ArrayList<>();
        for (String event : events) {
            if (!WebhookEventType.isValid(event)) {
                invalid.add(event);
            }
        }
        if (!invalid.isEmpty()) {
            errors.put("invalid_events", invalid);
            errors.put("valid_events", WebhookEventType.allValues());
        }
    }

    private void validateSecret(String secret, Map<String, Object> errors) {
        if (secret == null || secret.trim().isEmpty()) {
            errors.put("secret_key", "Secret key is required");
        } else if (secret.length() < minSecretLength) {
            errors.put("secret_key", "Secret key must be at least " + minSecretLength + " characters");
        }
    }

    private void validateThreshold(Integer maxFailedAttempts, Map<String, Object> errors) {
        if (maxFailedAttempts != null && maxFailedAttempts < 1) {
            errors.put("max_failed_attempts", "Must be at least 1");
        }
    }

    private void throwIfInvalid(Map<String, Object> errors) {
        if (!errors.isEmpty()) {
            Set<String> fields = errors.keySet();
            logger.warn("Rejected subscription request, invalid fields: {}", fields);
            throw new SubscriptionValidationException("Invalid subscription request", errors);
        }
    }
}

package com.company.eventrelay.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import javax.persistence.CollectionTable;
import javax.persistence.Column;
import javax.persistence.ElementCollection;
import javax.persistence.Entity;
import javax.persistence.EntityListeners;
import javax.persistence.FetchType;
import javax.persistence.GeneratedValue;
import javax.persistence.GenerationType;
import javax.persistence.Id;
import javax.persistence.Index;
import javax.persistence.JoinColumn;
import javax.persistence.Table;
import javax.persistence.Version;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Entity representing an external subscriber (webhook endpoint) together with
 * the events it is interested in and its delivery health.
 *
 * Health fields are only changed through the bulk update statements of
 * {@link com.company.eventrelay.domain.repository.WebhookSubscriptionRepository},
 * never by loading and saving the entity.
 */
@Entity
@Table(name = "webhook_subscriptions",
        indexes = @Index(name = "idx_webhook_subscriptions_active", columnList = "is_active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EntityListeners(AuditingEntityListener.class)
public class WebhookSubscription {

    /**
     * Unique identifier for the subscription.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    /**
     * Display label of the subscriber. Not unique.
     */
    @Column(name = "agent_name", nullable = false)
    private String agentName;

    /**
     * Endpoint that receives the signed POST requests.
     */
    @Column(name = "webhook_url", nullable = false, length = 2048)
    private String webhookUrl;

    /**
     * Event types the subscriber wants, stored one row per event so the
     * lookup by event type is an indexed join.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_subscription_events",
            joinColumns = @JoinColumn(name = "subscription_id"),
            indexes = @Index(name = "idx_webhook_subscription_events_event", columnList = "event_type"))
    @Column(name = "event_type", nullable = false)
    @Builder.Default
    private Set<String> events = new HashSet<>();

    /**
     * Key used to sign outbound payloads. Never logged or returned by the API.
     */
    @ToString.Exclude
    @Column(name = "shared_secret", nullable = false)
    private String sharedSecret;

    /**
     * False once the failure threshold is reached or the subscriber was disabled.
     */
    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    /**
     * Consecutive failed deliveries since the last success.
     */
    @Column(name = "failed_attempts", nullable = false)
    @Builder.Default
    private Integer failedAttempts = 0;

    /**
     * Number of consecutive failed deliveries after which the subscription is deactivated.
     */
    @Column(name = "max_failed_attempts", nullable = false)
    @Builder.Default
    private Integer maxFailedAttempts = 5;

    /**
     * Last time the subscriber acknowledged a delivery.
     */
    @Column(name = "last_successful_call")
    private LocalDateTime lastSuccessfulCall;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Lock version. Bulk health updates bump it so a stale save fails instead
     * of overwriting the counters.
     */
    @Version
    private Long version;

    /**
     * Checks if this subscription is interested in a specific event type.
     *
     * @param eventType The event wire value
     * @return true if the event is part of the subscription
     */
    public boolean isSubscribedTo(String eventType) {
        return events != null && events.contains(eventType);
    }
}

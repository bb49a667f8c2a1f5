package com.company.eventrelay.domain.repository;

import com.company.eventrelay.domain.model.WebhookSubscription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for WebhookSubscription entities.
 * Health counters are changed with single UPDATE statements so concurrent
 * deliveries for the same subscription never lose an update.
 */
@Repository
public interface WebhookSubscriptionRepository extends JpaRepository<WebhookSubscription, UUID> {

    /**
     * Finds active subscriptions interested in an event type.
     * Joins the indexed event table instead of filtering in memory.
     *
     * @param eventType The event wire value
     * @return List of matching active subscriptions
     */
    @Query("SELECT DISTINCT s FROM WebhookSubscription s JOIN s.events e " +
           "WHERE s.isActive = true AND e = :eventType")
    List<WebhookSubscription> findActiveByEventType(@Param("eventType") String eventType);

    /**
     * Records an acknowledged delivery: resets the failure counter and stamps the call time.
     *
     * @return number of rows updated (0 if the subscription no longer exists)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookSubscription s SET s.failedAttempts = 0, s.lastSuccessfulCall = :now, " +
           "s.updatedAt = :now, s.version = s.version + 1 WHERE s.id = :id")
    int markSuccess(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * Increments the consecutive failure counter.
     * Takes the row lock that {@link #deactivateIfThresholdReached} relies on.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookSubscription s SET s.failedAttempts = s.failedAttempts + 1, " +
           "s.updatedAt = :now, s.version = s.version + 1 WHERE s.id = :id")
    int incrementFailedAttempts(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * Deactivates the subscription if its failure counter reached the threshold.
     *
     * @return 1 if this call switched the subscription off, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookSubscription s SET s.isActive = false, s.updatedAt = :now, " +
           "s.version = s.version + 1 " +
           "WHERE s.id = :id AND s.isActive = true AND s.failedAttempts >= s.maxFailedAttempts")
    int deactivateIfThresholdReached(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * Explicitly reactivates a subscription. The only path from inactive to active;
     * the failure counter starts over.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookSubscription s SET s.isActive = true, s.failedAttempts = 0, " +
           "s.updatedAt = :now, s.version = s.version + 1 WHERE s.id = :id")
    int activate(@Param("id") UUID id, @Param("now") LocalDateTime now);

    /**
     * Explicitly deactivates a subscription.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE WebhookSubscription s SET s.isActive = false, " +
           "s.updatedAt = :now, s.version = s.version + 1 WHERE s.id = :id")
    int deactivate(@Param("id") UUID id, @Param("now") LocalDateTime now);

    long countByIsActive(Boolean isActive);

    long countByLastSuccessfulCallAfter(LocalDateTime since);
}

package com.company.eventrelay.domain.repository;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import com.company.eventrelay.domain.model.Notification;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for host notifications.
 * Every mutating query is scoped by host id so a host can never touch
 * another host's rows.
 */
@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID>, NotificationRepositoryCustom {

    /**
     * Finds unread, unexpired notifications created at or after a point in time, newest first.
     * Used by the real-time stream poll.
     */
    @Query("SELECT n FROM Notification n WHERE n.hostId = :hostId AND n.isRead = false " +
           "AND n.createdAt >= :since AND (n.expiresAt IS NULL OR n.expiresAt > :now) " +
           "ORDER BY n.createdAt DESC")
    List<Notification> findRecentUnread(@Param("hostId") String hostId,
                                        @Param("since") LocalDateTime since,
                                        @Param("now") LocalDateTime now,
                                        Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Notification n SET n.isRead = true, n.updatedAt = :now " +
           "WHERE n.id = :id AND n.hostId = :hostId")
    int markRead(@Param("id") UUID id, @Param("hostId") String hostId, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Notification n SET n.isRead = true, n.updatedAt = :now " +
           "WHERE n.hostId = :hostId AND n.isRead = false")
    int markAllRead(@Param("hostId") String hostId, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Notification n WHERE n.id = :id AND n.hostId = :hostId")
    int deleteOwned(@Param("id") UUID id, @Param("hostId") String hostId);

    @Query("SELECT COUNT(n) FROM Notification n WHERE n.hostId = :hostId AND n.isRead = false " +
           "AND (n.expiresAt IS NULL OR n.expiresAt > :now)")
    long countUnread(@Param("hostId") String hostId, @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM Notification n WHERE n.expiresAt IS NOT NULL AND n.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);

    long countByHostId(String hostId);

    long countByHostIdAndIsRead(String hostId, Boolean isRead);

    long countByHostIdAndCreatedAtAfter(String hostId, LocalDateTime since);

    @Query("SELECT n.type AS notificationType, COUNT(n) AS total FROM Notification n " +
           "WHERE n.hostId = :hostId GROUP BY n.type")
    List<TypeCount> countByType(@Param("hostId") String hostId);

    @Query("SELECT n.priority AS notificationPriority, COUNT(n) AS total FROM Notification n " +
           "WHERE n.hostId = :hostId GROUP BY n.priority")
    List<PriorityCount> countByPriority(@Param("hostId") String hostId);

    /**
     * Interface to hold per-type counts.
     */
    interface TypeCount {
        NotificationType getNotificationType();
        Long getTotal();
    }

    /**
     * Interface to hold per-priority counts.
     */
    interface PriorityCount {
        NotificationPriority getNotificationPriority();
        Long getTotal();
    }
}

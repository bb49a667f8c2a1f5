package com.company.eventrelay.domain.model;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import javax.persistence.Column;
import javax.persistence.Entity;
import javax.persistence.EntityListeners;
import javax.persistence.EnumType;
import javax.persistence.Enumerated;
import javax.persistence.GeneratedValue;
import javax.persistence.GenerationType;
import javax.persistence.Id;
import javax.persistence.Index;
import javax.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Entity representing an in-app notification addressed to a single host.
 * Only the owning host may read or change it.
 */
@Entity
@Table(name = "host_notifications", indexes = {
        @Index(name = "idx_host_notifications_host_created", columnList = "host_id, created_at"),
        @Index(name = "idx_host_notifications_expires", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EntityListeners(AuditingEntityListener.class)
public class Notification {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    /**
     * Owning dashboard user.
     */
    @Column(name = "host_id", nullable = false)
    private String hostId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32)
    private NotificationType type;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "message", nullable = false, length = 2000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    @Builder.Default
    private NotificationPriority priority = NotificationPriority.MEDIUM;

    /**
     * Correlation identifiers. Not enforced as foreign keys.
     */
    @Column(name = "booking_id")
    private String bookingId;

    @Column(name = "property_id")
    private String propertyId;

    @Column(name = "action_required", nullable = false)
    @Builder.Default
    private Boolean actionRequired = false;

    @Column(name = "action_url")
    private String actionUrl;

    /**
     * Only ever goes from false to true.
     */
    @Column(name = "is_read", nullable = false)
    @Builder.Default
    private Boolean isRead = false;

    /**
     * Past this instant the notification is hidden from listings and purged.
     */
    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}

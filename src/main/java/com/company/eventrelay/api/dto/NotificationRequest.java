package com.company.eventrelay.api.dto;

import com.company.eventrelay.domain.enums.NotificationPriority;
import com.company.eventrelay.domain.enums.NotificationType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.LocalDateTime;

/**
 * Data Transfer Object for creating a host notification directly.
 * Unknown types or priorities are rejected while the body is read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {

    @NotNull(message = "Notification type is required")
    private NotificationType type;

    @NotBlank(message = "Title is required")
    private String title;

    @NotBlank(message = "Message is required")
    private String message;

    private NotificationPriority priority;
    private String bookingId;
    private String propertyId;
    private boolean actionRequired;
    private String actionUrl;
    private LocalDateTime expiresAt;
}

package com.company.eventrelay.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToggleResponse {

    private UUID subscriptionId;
    private String previousStatus;
    private String newStatus;
    private Integer failedAttempts;

    public static String statusLabel(boolean active) {
        return active ? "active" : "inactive";
    }
}

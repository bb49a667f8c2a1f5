package com.company.eventrelay.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Partial update of a subscription. Absent fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionUpdateRequest {

    private String agentName;
    private String webhookUrl;
    private List<String> events;

    @ToString.Exclude
    private String secretKey;
}

package com.company.eventrelay.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Manual delivery cycle request, for verifying subscriber endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookTestRequest {

    @NotBlank(message = "Event type is required")
    private String eventType;

    private Map<String, Object> data;
}

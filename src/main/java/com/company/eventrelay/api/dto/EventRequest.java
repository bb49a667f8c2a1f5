package com.company.eventrelay.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import java.util.Map;

/**
 * Domain event submitted by an internal producer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventRequest {

    @NotBlank(message = "Event type is required")
    private String eventType;

    @NotBlank(message = "Host id is required")
    private String hostId;

    private String bookingId;
    private String propertyId;

    /**
     * Opaque event data forwarded to subscribers.
     */
    private Map<String, Object> data;
}

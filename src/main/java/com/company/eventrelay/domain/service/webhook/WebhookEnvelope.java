package com.company.eventrelay.domain.service.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Body of every outbound webhook call.
 */
@Getter
@AllArgsConstructor
@JsonPropertyOrder({"event_type", "timestamp", "data"})
public class WebhookEnvelope {

    @JsonProperty("event_type")
    private final String eventType;

    /**
     * ISO-8601 instant at which the envelope was built.
     */
    @JsonProperty("timestamp")
    private final String timestamp;

    /**
     * Opaque event data supplied by the producer.
     */
    @JsonProperty("data")
    private final Map<String, Object> data;
}

package com.company.eventrelay.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Custom event pushed to open streams.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamEventRequest {

    /**
     * SSE event name. Broadcasts default to {@code system_announcement}.
     */
    private String type;

    private Object data;
}

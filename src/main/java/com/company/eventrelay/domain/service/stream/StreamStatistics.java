package com.company.eventrelay.domain.service.stream;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StreamStatistics {

    private int totalConnections;
    private int maxConnections;
    private long heartbeatIntervalMs;

    /**
     * Open streams of the requested host; absent when no host was given.
     */
    private Integer userConnections;
}

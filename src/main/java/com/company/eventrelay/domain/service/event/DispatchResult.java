package com.company.eventrelay.domain.service.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * What happened synchronously when an event was dispatched.
 */
@Data
@Builder
@AllArgsConstructor
public class DispatchResult {

    private String eventType;

    /**
     * The notification written for the host. Always present: dispatch fails otherwise.
     */
    private UUID notificationId;

    /**
     * Whether webhook delivery was handed to the background runner.
     */
    private boolean deliveryEnqueued;

    /**
     * Completes when the background delivery finished, with false if it never ran
     * or gave up.
     */
    @JsonIgnore
    private CompletableFuture<Boolean> deliveryCompletion;
}

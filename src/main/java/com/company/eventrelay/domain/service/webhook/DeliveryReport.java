package com.company.eventrelay.domain.service.webhook;

import com.company.eventrelay.domain.enums.DeliveryStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * Summary of one delivery cycle of an event to all matching subscribers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryReport {

    private String eventType;
    private DeliveryStatus status;
    private int totalSubscribers;
    private int successful;
    private int failed;

    @Builder.Default
    private List<SubscriberOutcome> outcomes = Collections.emptyList();

    /**
     * Builds a report from the per-subscriber outcomes.
     *
     * @param eventType The delivered event
     * @param outcomes One outcome per subscriber
     * @return The report with its overall status
     */
    public static DeliveryReport of(String eventType, List<SubscriberOutcome> outcomes) {
        int successful = (int) outcomes.stream().filter(SubscriberOutcome::isDelivered).count();
        int failed = outcomes.size() - successful;

        DeliveryStatus status;
        if (outcomes.isEmpty()) {
            status = DeliveryStatus.NO_SUBSCRIBERS;
        } else if (failed == 0) {
            status = DeliveryStatus.DELIVERED;
        } else if (successful == 0) {
            status = DeliveryStatus.ALL_FAILED;
        } else {
            status = DeliveryStatus.PARTIAL_FAILURE;
        }

        return DeliveryReport.builder()
                .eventType(eventType)
                .status(status)
                .totalSubscribers(outcomes.size())
                .successful(successful)
                .failed(failed)
                .outcomes(outcomes)
                .build();
    }

    public static DeliveryReport noSubscribers(String eventType) {
        return of(eventType, Collections.emptyList());
    }
}

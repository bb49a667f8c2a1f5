package com.company.eventrelay.domain.service.webhook;

import java.util.Map;
import java.util.UUID;

/**
 * Service interface for delivering events to external webhook subscribers.
 * Every subscriber is delivered to independently with its own retry budget, and the
 * outcome of each delivery is written back to the subscription registry.
 */
public interface WebhookDeliveryService {

    /**
     * Delivers an event to every active subscription interested in it.
     * Blocks until each subscriber has either acknowledged or exhausted its attempts.
     *
     * @param eventType The event wire value, e.g. {@code booking.created}
     * @param data Opaque event data, placed in the envelope unchanged
     * @return Report with one outcome per subscriber, or status NO_SUBSCRIBERS
     */
    DeliveryReport deliverEvent(String eventType, Map<String, Object> data);

    /**
     * Sends a {@code test.webhook} event to one subscription, regardless of its event list
     * and of its active flag.
     *
     * @param subscriptionId The subscription to test
     * @param data Optional data for the test envelope
     * @return Report with a single outcome
     */
    DeliveryReport deliverTestEvent(UUID subscriptionId, Map<String, Object> data);
}

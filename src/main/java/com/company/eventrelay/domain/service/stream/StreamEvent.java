package com.company.eventrelay.domain.service.stream;

import com.company.eventrelay.domain.enums.StreamEventType;
import com.company.eventrelay.domain.model.BookingChange;
import com.company.eventrelay.domain.model.Notification;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One typed event on a host's real-time stream.
 * Serialized as the frame data {@code {type, timestamp, data}}; the type is also the
 * SSE event name and {@link #getId()} the SSE id.
 */
@Value
@JsonPropertyOrder({"type", "timestamp", "data"})
public class StreamEvent {

    String type;
    String timestamp;
    Object data;

    /**
     * Frame id, set for notifications so clients can de-duplicate.
     */
    @JsonIgnore
    String id;

    public static StreamEvent of(String type, Object data) {
        return new StreamEvent(type, Instant.now().toString(), data, null);
    }

    public static StreamEvent connected(String hostId, String connectionId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("host_id", hostId);
        data.put("connection_id", connectionId);
        data.put("message", "Connected to real-time notifications");
        return of(StreamEventType.CONNECTED.getValue(), data);
    }

    public static StreamEvent notification(Notification notification) {
        return new StreamEvent(StreamEventType.NOTIFICATION.getValue(), Instant.now().toString(),
                notification, String.valueOf(notification.getId()));
    }

    public static StreamEvent bookingUpdate(BookingChange change) {
        return of(StreamEventType.BOOKING_UPDATE.getValue(), change);
    }

    public static StreamEvent heartbeat() {
        return of(StreamEventType.HEARTBEAT.getValue(), null);
    }

    @JsonIgnore
    public boolean isHeartbeat() {
        return StreamEventType.HEARTBEAT.getValue().equals(type);
    }
}

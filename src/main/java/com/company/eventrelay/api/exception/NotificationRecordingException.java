package com.company.eventrelay.api.exception;

/**
 * Exception thrown when a dispatched event could not be recorded as a
 * notification. The caller must treat the event as not recorded.
 */
public class NotificationRecordingException extends RuntimeException {

    private final String eventType;
    private final String hostId;

    public NotificationRecordingException(String eventType, String hostId, Throwable cause) {
        super("Failed to record notification for event " + eventType + " and host " + hostId, cause);
        this.eventType = eventType;
        this.hostId = hostId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getHostId() {
        return hostId;
    }
}

package com.company.eventrelay.domain.service.stream;

/**
 * The client's transport rejected a write. Never retried; the connection is torn down.
 */
public class ChannelWriteException extends RuntimeException {

    public ChannelWriteException(String connectionId, Throwable cause) {
        super("Write to stream " + connectionId + " failed: " + cause.getMessage(), cause);
    }
}

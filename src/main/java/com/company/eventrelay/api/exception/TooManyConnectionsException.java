package com.company.eventrelay.api.exception;

/**
 * Exception thrown when a new real-time stream would exceed the configured
 * connection cap. New connections are rejected, never queued.
 */
public class TooManyConnectionsException extends RuntimeException {

    private final int maxConnections;

    public TooManyConnectionsException(int maxConnections) {
        super("Too many open event streams, limit is " + maxConnections);
        this.maxConnections = maxConnections;
    }

    public int getMaxConnections() {
        return maxConnections;
    }
}

package com.company.eventrelay.domain.service.stream;

import com.company.eventrelay.api.exception.TooManyConnectionsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Open real-time streams keyed by host, with a global cap on their number.
 * Connections are inserted on connect and removed on close; nothing else holds them.
 */
@Component
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Map<String, Set<StreamConnection>> connectionsByHost = new ConcurrentHashMap<>();
    private final AtomicInteger totalConnections = new AtomicInteger();
    private final int maxConnections;

    public ConnectionRegistry(@Value("${sse.max-connections:1000}") int maxConnections) {
        this.maxConnections = maxConnections;
    }

    /**
     * Adds a connection.
     *
     * @throws TooManyConnectionsException if the cap is already reached
     */
    public void register(StreamConnection connection) {
        int current;
        do {
            current = totalConnections.get();
            if (current >= maxConnections) {
                logger.warn("Rejecting stream for host {}: {} of {} connections open",
                        connection.getHostId(), current, maxConnections);
                throw new TooManyConnectionsException(maxConnections);
            }
        } while (!totalConnections.compareAndSet(current, current + 1));

        connectionsByHost.compute(connection.getHostId(), (hostId, connections) -> {
            Set<StreamConnection> set = connections != null ? connections : ConcurrentHashMap.newKeySet();
            set.add(connection);
            return set;
        });
        logger.debug("Registered stream {} for host {} ({} open)", connection.getId(), connection.getHostId(),
                totalConnections.get());
    }

    /**
     * Removes a connection. Removing an unknown connection is a no-op.
     *
     * @return true if the connection was registered
     */
    public boolean remove(StreamConnection connection) {
        boolean[] removed = new boolean[1];
        connectionsByHost.computeIfPresent(connection.getHostId(), (hostId, connections) -> {
            removed[0] = connections.remove(connection);
            return connections.isEmpty() ? null : connections;
        });
        if (removed[0]) {
            totalConnections.decrementAndGet();
        }
        return removed[0];
    }

    public List<StreamConnection> connectionsFor(String hostId) {
        Set<StreamConnection> connections = connectionsByHost.get(hostId);
        return connections == null ? Collections.emptyList() : new ArrayList<>(connections);
    }

    public List<StreamConnection> allConnections() {
        List<StreamConnection> all = new ArrayList<>();
        connectionsByHost.values().forEach(all::addAll);
        return all;
    }

    public int totalConnections() {
        return totalConnections.get();
    }

    public int connectionCount(String hostId) {
        Set<StreamConnection> connections = connectionsByHost.get(hostId);
        return connections == null ? 0 : connections.size();
    }

    public int getMaxConnections() {
        return maxConnections;
    }
}

package com.company.eventrelay.domain.service.stream;

import com.company.eventrelay.domain.enums.StreamEventType;
import com.company.eventrelay.domain.model.BookingChange;
import com.company.eventrelay.domain.model.Notification;
import com.company.eventrelay.domain.service.notification.NotificationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import javax.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;

/**
 * Real-time event streams for hosts.
 *
 * <p>Each open stream is polled on the stream scheduler: new unread notifications
 * and changed bookings are queued, followed by a heartbeat. Ticks never write to the
 * client; the queue is drained by a per-connection writer on the stream writer pool,
 * so a client that reads slowly only fills its own bounded queue. A write failure or
 * client disconnect closes the stream, cancels its poll task and removes it from the
 * registry. Streams only read; they never mark notifications read.
 */
@Service
public class EventStreamService {

    private static final Logger logger = LoggerFactory.getLogger(EventStreamService.class);

    private final ConnectionRegistry connectionRegistry;
    private final NotificationService notificationService;
    private final BookingChangeFeed bookingChangeFeed;
    private final TaskScheduler streamScheduler;
    private final Executor streamWriter;
    private final ObjectMapper objectMapper;

    private final long pollIntervalMs;
    private final long pollOverlapMs;
    private final int pollLimit;
    private final int queueCapacity;
    private final long emitterTimeoutMs;

    public EventStreamService(
            ConnectionRegistry connectionRegistry,
            NotificationService notificationService,
            BookingChangeFeed bookingChangeFeed,
            @Qualifier("streamScheduler") TaskScheduler streamScheduler,
            @Qualifier("streamWriterExecutor") Executor streamWriter,
            ObjectMapper objectMapper,
            @Value("${sse.poll-interval-ms:5000}") long pollIntervalMs,
            @Value("${sse.poll-overlap-ms:1000}") long pollOverlapMs,
            @Value("${sse.poll-limit:10}") int pollLimit,
            @Value("${sse.queue-capacity:100}") int queueCapacity,
            @Value("${sse.emitter-timeout-ms:0}") long emitterTimeoutMs) {
        this.connectionRegistry = connectionRegistry;
        this.notificationService = notificationService;
        this.bookingChangeFeed = bookingChangeFeed;
        this.streamScheduler = streamScheduler;
        this.streamWriter = streamWriter;
        this.objectMapper = objectMapper;
        this.pollIntervalMs = pollIntervalMs;
        this.pollOverlapMs = pollOverlapMs;
        this.pollLimit = pollLimit;
        this.queueCapacity = queueCapacity;
        this.emitterTimeoutMs = emitterTimeoutMs;
    }

    /**
     * Opens a stream for a host.
     *
     * @param hostId The authenticated host
     * @return The emitter to hand to Spring MVC
     * @throws com.company.eventrelay.api.exception.TooManyConnectionsException past the connection cap
     */
    public SseEmitter openStream(String hostId) {
        return open(hostId, new SseEmitter(emitterTimeoutMs)).getEmitter();
    }

    /**
     * Registers the connection, sends the {@code connected} event and starts polling.
     */
    StreamConnection open(String hostId, SseEmitter emitter) {
        StreamConnection connection = new StreamConnection(hostId, emitter, objectMapper, queueCapacity);
        connectionRegistry.register(connection);

        emitter.onCompletion(() -> close(connection, "completed"));
        emitter.onTimeout(() -> close(connection, "timeout"));
        emitter.onError(e -> close(connection, "error: " + e.getMessage()));

        connection.enqueue(StreamEvent.connected(hostId, connection.getId()));
        flush(connection);

        if (!connection.isClosed()) {
            ScheduledFuture<?> pollTask = streamScheduler.scheduleAtFixedRate(
                    () -> poll(connection),
                    Instant.now().plusMillis(pollIntervalMs),
                    Duration.ofMillis(pollIntervalMs));
            connection.setPollTask(pollTask);
            // close may have run between the check and the assignment
            if (connection.isClosed()) {
                pollTask.cancel(false);
            }
        }

        logger.info("Opened event stream {} for host {} ({} open)", connection.getId(), hostId,
                connectionRegistry.totalConnections());
        return connection;
    }

    /**
     * One poll tick of a stream. A failing query is logged and the tick goes on,
     * so the heartbeat is always sent.
     */
    void poll(StreamConnection connection) {
        if (connection.isClosed()) {
            return;
        }
        try {
            LocalDateTime tickStart = LocalDateTime.now();
            LocalDateTime since = connection.getLastPolledAt().minusNanos(pollOverlapMs * 1_000_000L);

            queueNotifications(connection, since);
            if (connection.isClosed()) {
                return;
            }
            queueBookingChanges(connection, since);

            connection.setLastPolledAt(tickStart);
            connection.enqueue(StreamEvent.heartbeat());
            flush(connection);
        } catch (RuntimeException e) {
            logger.error("Unexpected error polling stream {} of host {}", connection.getId(),
                    connection.getHostId(), e);
        }
    }

    private void queueNotifications(StreamConnection connection, LocalDateTime since) {
        try {
            List<Notification> notifications = notificationService.recentSince(connection.getHostId(), since, pollLimit);
            for (Notification notification : notifications) {
                if (connection.markSeen("notification:" + notification.getId())) {
                    connection.enqueue(StreamEvent.notification(notification));
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Notification poll failed for stream {} of host {}: {}", connection.getId(),
                    connection.getHostId(), e.getMessage());
        }
    }

    private void queueBookingChanges(StreamConnection connection, LocalDateTime since) {
        try {
            List<BookingChange> changes = new ArrayList<>(
                    bookingChangeFeed.changedSince(connection.getHostId(), since, pollLimit));
            for (int i = changes.size() - 1; i >= 0; i--) {
                BookingChange change = changes.get(i);
                if (connection.markSeen("booking:" + change.getBookingId() + ":" + change.getUpdatedAt())) {
                    connection.enqueue(StreamEvent.bookingUpdate(change));
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Booking poll failed for stream {} of host {}: {}", connection.getId(),
                    connection.getHostId(), e.getMessage());
        }
    }

    /**
     * Hands the connection's queue to a writer unless one is already pending or running.
     */
    private void flush(StreamConnection connection) {
        if (!connection.claimWriter()) {
            return;
        }
        try {
            streamWriter.execute(() -> drain(connection));
        } catch (RejectedExecutionException e) {
            connection.releaseWriter();
            logger.warn("No writer available for stream {} of host {}, {} event(s) stay queued",
                    connection.getId(), connection.getHostId(), connection.queuedEvents());
        }
    }

    private void drain(StreamConnection connection) {
        try {
            connection.flush();
        } catch (ChannelWriteException e) {
            logger.info("Closing stream {} of host {}: {}", connection.getId(), connection.getHostId(),
                    e.getMessage());
            close(connection, "write failure");
        } catch (RuntimeException e) {
            logger.error("Unexpected error writing stream {} of host {}", connection.getId(),
                    connection.getHostId(), e);
        } finally {
            connection.releaseWriter();
        }
        // events queued between the last dequeue and the release need a writer too
        if (!connection.isClosed() && connection.queuedEvents() > 0) {
            flush(connection);
        }
    }

    /**
     * Closes a stream and releases its poll task and registry slot. Idempotent.
     */
    public void close(StreamConnection connection, String reason) {
        if (!connection.markClosed()) {
            return;
        }
        ScheduledFuture<?> pollTask = connection.getPollTask();
        if (pollTask != null) {
            pollTask.cancel(false);
        }
        connectionRegistry.remove(connection);
        try {
            connection.getEmitter().complete();
        } catch (IllegalStateException e) {
            logger.debug("Emitter of stream {} already completed", connection.getId());
        }
        logger.info("Closed event stream {} of host {} ({}), {} event(s) dropped", connection.getId(),
                connection.getHostId(), reason, connection.getDroppedEvents());
    }

    /**
     * Pushes a custom event to every open stream of a host.
     *
     * @return number of streams the event was queued on
     */
    public int sendToHost(String hostId, StreamEvent event) {
        int delivered = 0;
        for (StreamConnection connection : connectionRegistry.connectionsFor(hostId)) {
            if (connection.enqueue(event)) {
                flush(connection);
                delivered++;
            }
        }
        logger.debug("Sent {} event to {} stream(s) of host {}", event.getType(), delivered, hostId);
        return delivered;
    }

    /**
     * Pushes an event to every open stream. A null type becomes {@code system_announcement}.
     *
     * @return number of streams the event was queued on
     */
    public int broadcast(String type, Object data) {
        String eventType = type != null ? type : StreamEventType.SYSTEM_ANNOUNCEMENT.getValue();
        StreamEvent event = StreamEvent.of(eventType, data);

        int delivered = 0;
        for (StreamConnection connection : connectionRegistry.allConnections()) {
            if (connection.enqueue(event)) {
                flush(connection);
                delivered++;
            }
        }
        logger.info("Broadcast {} event to {} stream(s)", eventType, delivered);
        return delivered;
    }

    public StreamStatistics statistics(String hostId) {
        return StreamStatistics.builder()
                .totalConnections(connectionRegistry.totalConnections())
                .maxConnections(connectionRegistry.getMaxConnections())
                .heartbeatIntervalMs(pollIntervalMs)
                .userConnections(hostId != null ? connectionRegistry.connectionCount(hostId) : null)
                .build();
    }

    /**
     * Completes every open stream on application shutdown.
     */
    @PreDestroy
    public void shutdown() {
        List<StreamConnection> connections = connectionRegistry.allConnections();
        if (!connections.isEmpty()) {
            logger.info("Closing {} event stream(s) on shutdown", connections.size());
        }
        connections.forEach(connection -> close(connection, "shutdown"));
    }
}

package com.company.eventrelay.domain.service.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One open real-time stream of a host.
 * Events are queued in a bounded buffer and written to the emitter by {@link #flush()},
 * which runs on a writer thread of its own. When the buffer is full the oldest
 * non-heartbeat event is dropped, so a slow client never blocks the poll loop.
 */
public class StreamConnection {

    private static final int SEEN_KEYS_CAPACITY = 512;

    private final String id;
    private final String hostId;
    private final SseEmitter emitter;
    private final ObjectMapper objectMapper;
    private final int queueCapacity;

    private final Deque<StreamEvent> queue = new ArrayDeque<>();
    private final ReentrantLock sendLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean writerScheduled = new AtomicBoolean(false);
    private final AtomicLong droppedEvents = new AtomicLong();
    private final Map<String, Boolean> seenKeys = new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > SEEN_KEYS_CAPACITY;
        }
    };

    private volatile ScheduledFuture<?> pollTask;
    private volatile LocalDateTime lastPolledAt;

    public StreamConnection(String hostId, SseEmitter emitter, ObjectMapper objectMapper, int queueCapacity) {
        this.id = UUID.randomUUID().toString();
        this.hostId = hostId;
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        this.queueCapacity = Math.max(1, queueCapacity);
        this.lastPolledAt = LocalDateTime.now();
    }

    /**
     * Queues an event for sending.
     *
     * @return false if the connection is already closed
     */
    public boolean enqueue(StreamEvent event) {
        if (closed.get()) {
            return false;
        }
        synchronized (queue) {
            if (queue.size() >= queueCapacity) {
                dropOldest();
            }
            queue.addLast(event);
        }
        return true;
    }

    private void dropOldest() {
        Iterator<StreamEvent> it = queue.iterator();
        while (it.hasNext()) {
            if (!it.next().isHeartbeat()) {
                it.remove();
                droppedEvents.incrementAndGet();
                return;
            }
        }
        queue.pollFirst();
    }

    /**
     * Writes queued events to the client in order. Returns immediately if another
     * thread is already flushing this connection.
     *
     * @return number of events written
     * @throws ChannelWriteException if the transport rejected a write
     */
    public int flush() {
        if (!sendLock.tryLock()) {
            return 0;
        }
        try {
            int sent = 0;
            StreamEvent event;
            while (!closed.get() && (event = nextEvent()) != null) {
                write(event);
                sent++;
            }
            return sent;
        } finally {
            sendLock.unlock();
        }
    }

    private StreamEvent nextEvent() {
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    private void write(StreamEvent event) {
        try {
            SseEmitter.SseEventBuilder frame = SseEmitter.event()
                    .name(event.getType())
                    .data(objectMapper.writeValueAsString(event));
            if (event.getId() != null) {
                frame.id(event.getId());
            }
            emitter.send(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stream event " + event.getType() + " cannot be serialized", e);
        } catch (IOException | IllegalStateException e) {
            throw new ChannelWriteException(id, e);
        }
    }

    /**
     * Claims the right to start a writer for this connection. At most one writer is
     * pending or running at a time.
     *
     * @return true if the caller must start a writer
     */
    boolean claimWriter() {
        return !closed.get() && writerScheduled.compareAndSet(false, true);
    }

    void releaseWriter() {
        writerScheduled.set(false);
    }

    /**
     * Remembers a key of an emitted row.
     *
     * @return true the first time a key is seen
     */
    public boolean markSeen(String key) {
        synchronized (seenKeys) {
            return seenKeys.put(key, Boolean.TRUE) == null;
        }
    }

    /**
     * Switches the connection to closed.
     *
     * @return true only for the call that actually closed it
     */
    boolean markClosed() {
        boolean first = closed.compareAndSet(false, true);
        if (first) {
            synchronized (queue) {
                queue.clear();
            }
        }
        return first;
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int queuedEvents() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public String getId() {
        return id;
    }

    public String getHostId() {
        return hostId;
    }

    public SseEmitter getEmitter() {
        return emitter;
    }

    public LocalDateTime getLastPolledAt() {
        return lastPolledAt;
    }

    void setLastPolledAt(LocalDateTime lastPolledAt) {
        this.lastPolledAt = lastPolledAt;
    }

    ScheduledFuture<?> getPollTask() {
        return pollTask;
    }

    void setPollTask(ScheduledFuture<?> pollTask) {
        this.pollTask = pollTask;
    }
}

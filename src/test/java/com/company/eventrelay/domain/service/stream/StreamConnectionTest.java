package com.company.eventrelay.domain.service.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StreamConnection Unit Tests")
class StreamConnectionTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private static StreamEvent custom(String name) {
        return StreamEvent.of(name, Collections.singletonMap("name", name));
    }

    @Test
    @DisplayName("Should write queued events in order as typed frames")
    void shouldFlushInOrder() {
        // Given
        CapturingSseEmitter emitter = new CapturingSseEmitter();
        StreamConnection connection = new StreamConnection("H1", emitter, objectMapper, 10);
        connection.enqueue(custom("first"));
        connection.enqueue(StreamEvent.heartbeat());

        // When
        int sent = connection.flush();

        // Then
        assertThat(sent).isEqualTo(2);
        assertThat(emitter.eventNames()).containsExactly("first", "heartbeat");
        assertThat(emitter.frames().get(0)).contains("\"type\":\"first\"").contains("\"timestamp\"");
        assertThat(connection.queuedEvents()).isZero();
    }

    @Test
    @DisplayName("Should drop the oldest non-heartbeat event when the buffer is full")
    void shouldDropOldestEvent() {
        // Given
        CapturingSseEmitter emitter = new CapturingSseEmitter();
        StreamConnection connection = new StreamConnection("H1", emitter, objectMapper, 3);
        connection.enqueue(StreamEvent.heartbeat());
        connection.enqueue(custom("a"));
        connection.enqueue(custom("b"));

        // When
        connection.enqueue(custom("c"));
        connection.flush();

        // Then
        assertThat(connection.getDroppedEvents()).isEqualTo(1);
        assertThat(emitter.eventNames()).containsExactly("heartbeat", "b", "c");
    }

    @Test
    @DisplayName("Should drop a heartbeat when only heartbeats are queued")
    void shouldDropHeartbeatWhenOnlyHeartbeatsQueued() {
        CapturingSseEmitter emitter = new CapturingSseEmitter();
        StreamConnection connection = new StreamConnection("H1", emitter, objectMapper, 2);
        connection.enqueue(StreamEvent.heartbeat());
        connection.enqueue(StreamEvent.heartbeat());

        connection.enqueue(custom("news"));
        connection.flush();

        assertThat(emitter.eventNames()).containsExactly("heartbeat", "news");
        assertThat(connection.getDroppedEvents()).isZero();
    }

    @Test
    @DisplayName("Should raise a channel write failure when the client is gone")
    void shouldFailOnBrokenTransport() {
        CapturingSseEmitter emitter = new CapturingSseEmitter();
        StreamConnection connection = new StreamConnection("H1", emitter, objectMapper, 10);
        emitter.failWrites();
        connection.enqueue(custom("lost"));

        assertThatThrownBy(connection::flush)
                .isInstanceOf(ChannelWriteException.class)
                .hasMessageContaining(connection.getId());
    }

    @Test
    @DisplayName("Should refuse events once closed")
    void shouldRefuseEventsWhenClosed() {
        StreamConnection connection = new StreamConnection("H1", new CapturingSseEmitter(), objectMapper, 10);
        connection.enqueue(custom("pending"));

        assertThat(connection.markClosed()).isTrue();
        assertThat(connection.markClosed()).isFalse();
        assertThat(connection.enqueue(custom("late"))).isFalse();
        assertThat(connection.queuedEvents()).isZero();
    }

    @Test
    @DisplayName("Should report a key as new only once")
    void shouldRememberSeenKeys() {
        StreamConnection connection = new StreamConnection("H1", new CapturingSseEmitter(), objectMapper, 10);

        assertThat(connection.markSeen("notification:1")).isTrue();
        assertThat(connection.markSeen("notification:1")).isFalse();
        assertThat(connection.markSeen("notification:2")).isTrue();
    }
}

package com.company.eventrelay.domain.service.stream;

import com.company.eventrelay.api.exception.TooManyConnectionsException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConnectionRegistry Unit Tests")
class ConnectionRegistryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private StreamConnection connection(String hostId) {
        return new StreamConnection(hostId, new SseEmitter(), objectMapper, 10);
    }

    @Test
    @DisplayName("Should track connections per host")
    void shouldTrackConnectionsPerHost() {
        // Given
        ConnectionRegistry registry = new ConnectionRegistry(10);
        StreamConnection first = connection("H1");
        StreamConnection second = connection("H1");
        StreamConnection other = connection("H2");

        // When
        registry.register(first);
        registry.register(second);
        registry.register(other);

        // Then
        assertThat(registry.totalConnections()).isEqualTo(3);
        assertThat(registry.connectionCount("H1")).isEqualTo(2);
        assertThat(registry.connectionsFor("H1")).containsExactlyInAnyOrder(first, second);
        assertThat(registry.connectionsFor("H3")).isEmpty();
        assertThat(registry.allConnections()).hasSize(3);
    }

    @Test
    @DisplayName("Should reject connections past the cap")
    void shouldEnforceCap() {
        ConnectionRegistry registry = new ConnectionRegistry(2);
        registry.register(connection("H1"));
        registry.register(connection("H2"));

        assertThatThrownBy(() -> registry.register(connection("H3")))
                .isInstanceOf(TooManyConnectionsException.class);
        assertThat(registry.totalConnections()).isEqualTo(2);
        assertThat(registry.connectionCount("H3")).isZero();
    }

    @Test
    @DisplayName("Should free a slot on removal and ignore repeated removal")
    void shouldRemoveIdempotently() {
        ConnectionRegistry registry = new ConnectionRegistry(1);
        StreamConnection connection = connection("H1");
        registry.register(connection);

        assertThat(registry.remove(connection)).isTrue();
        assertThat(registry.remove(connection)).isFalse();
        assertThat(registry.totalConnections()).isZero();
        assertThat(registry.connectionsFor("H1")).isEmpty();

        registry.register(connection("H2"));
        assertThat(registry.totalConnections()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should never exceed the cap under concurrent registration")
    void shouldHoldCapConcurrently() throws Exception {
        // Given
        ConnectionRegistry registry = new ConnectionRegistry(25);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger rejected = new AtomicInteger();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            String hostId = "H" + (i % 7);
            tasks.add(() -> {
                try {
                    start.await();
                    registry.register(connection(hostId));
                } catch (TooManyConnectionsException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        // When
        tasks.forEach(pool::execute);
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        assertThat(registry.totalConnections()).isEqualTo(25);
        assertThat(registry.allConnections()).hasSize(25);
        assertThat(rejected.get()).isEqualTo(75);
    }
}

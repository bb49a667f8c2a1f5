package com.company.eventrelay.api.controller;

import com.company.eventrelay.api.dto.StreamEventRequest;
import com.company.eventrelay.domain.service.stream.EventStreamService;
import com.company.eventrelay.domain.service.stream.StreamEvent;
import com.company.eventrelay.domain.service.stream.StreamStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST Controller for hosts' real-time event streams.
 */
@RestController
@RequestMapping("/api/v1")
public class EventStreamController {

    private static final Logger logger = LoggerFactory.getLogger(EventStreamController.class);

    private final EventStreamService eventStreamService;

    public EventStreamController(EventStreamService eventStreamService) {
        this.eventStreamService = eventStreamService;
    }

    /**
     * Opens a long-lived stream emitting {@code connected}, {@code notification},
     * {@code booking_update}, {@code heartbeat} and custom events.
     */
    @GetMapping(value = "/hosts/{hostId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String hostId) {
        logger.info("Opening event stream for host {}", hostId);
        return eventStreamService.openStream(hostId);
    }

    @PostMapping("/hosts/{hostId}/events/send")
    public ResponseEntity<Map<String, Object>> sendToHost(@PathVariable String hostId,
                                                          @RequestBody StreamEventRequest request) {
        if (request.getType() == null || request.getType().trim().isEmpty()) {
            throw new IllegalArgumentException("Event type is required");
        }

        int notified = eventStreamService.sendToHost(hostId, StreamEvent.of(request.getType(), request.getData()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("host_id", hostId);
        body.put("event_type", request.getType());
        body.put("connections_notified", notified);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/sse/broadcast")
    public ResponseEntity<Map<String, Object>> broadcast(@RequestBody StreamEventRequest request) {
        int notified = eventStreamService.broadcast(request.getType(), request.getData());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("connections_notified", notified);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/sse/statistics")
    public ResponseEntity<StreamStatistics> statistics(
            @RequestParam(name = "host_id", required = false) String hostId) {
        return ResponseEntity.ok(eventStreamService.statistics(hostId));
    }
}

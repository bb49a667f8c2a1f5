package com.company.eventrelay.api.controller;

import com.company.eventrelay.api.dto.EventRequest;
import com.company.eventrelay.domain.service.event.DispatchResult;
import com.company.eventrelay.domain.service.event.EventCorrelation;
import com.company.eventrelay.domain.service.event.EventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;

/**
 * Entry point for domain events raised by the booking and payment side of the platform.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventDispatcher eventDispatcher;

    public EventController(EventDispatcher eventDispatcher) {
        this.eventDispatcher = eventDispatcher;
    }

    /**
     * Records the event as a notification and schedules webhook delivery.
     *
     * @return 202 once the notification is stored; delivery continues in the background
     */
    @PostMapping
    public ResponseEntity<DispatchResult> dispatch(@Valid @RequestBody EventRequest request) {
        logger.info("Received event {} for host {}", request.getEventType(), request.getHostId());

        DispatchResult result = eventDispatcher.dispatch(
                request.getEventType(),
                request.getHostId(),
                EventCorrelation.of(request.getBookingId(), request.getPropertyId()),
                request.getData());

        return new ResponseEntity<>(result, HttpStatus.ACCEPTED);
    }
}

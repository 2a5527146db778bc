package com.hermes.api.rest;

import com.hermes.core.model.Event;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.pagination.PaginationPolicy;
import com.hermes.core.representation.RepresentationSelector;
import com.hermes.engine.service.EventService;
import com.hermes.engine.service.PagedResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Read-only REST API for the event log.
 */
@RestController
@RequestMapping("${hermes.api.base-path:/api/v1}/events")
public class EventController {

    private final EventService eventService;
    private final PaginationPolicy paginationPolicy;
    private final String basePath;

    public EventController(
            EventService eventService,
            PaginationPolicy paginationPolicy,
            RepresentationSelector selector) {
        this.eventService = eventService;
        this.paginationPolicy = paginationPolicy;
        this.basePath = selector.basePath();
    }

    /**
     * List events, oldest first.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<EventListResponse>> listEvents(
            @RequestParam(required = false) String hostname,
            @RequestParam(required = false) Long eventTypeId,
            @RequestParam(required = false) String offset,
            @RequestParam(required = false) String limit) {
        
        PageRequest page = paginationPolicy.resolve(offset, limit, null);
        PagedResult<Event> events = eventService.queryEvents(hostname, eventTypeId, page);
        
        return ResponseEntity.ok(ApiResponse.ok(new EventListResponse(
            page.limit(),
            page.offset(),
            events.total(),
            events.items().stream().map(e -> e.toDict(basePath)).toList()
        )));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getEvent(@PathVariable long id) {
        return ResponseEntity.ok(ApiResponse.ok(eventService.getEvent(id).toDict(basePath)));
    }

    // ========== DTOs ==========

    public record EventListResponse(
        int limit,
        int offset,
        long totalEvents,
        List<Map<String, Object>> events
    ) {}
}

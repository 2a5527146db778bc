package com.hermes.api.rest;

import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.pagination.PaginationPolicy;
import com.hermes.core.repository.EventTypeRepository.EventTypeQuery;
import com.hermes.core.representation.RepresentationSelector;
import com.hermes.engine.aggregation.EventTypeDocument;
import com.hermes.engine.aggregation.ResourceAggregator;
import com.hermes.engine.service.DeleteResult;
import com.hermes.engine.service.EventTypeService;
import com.hermes.engine.service.PagedResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * REST API for the event type catalog.
 */
@RestController
@RequestMapping("${hermes.api.base-path:/api/v1}/eventtypes")
public class EventTypeController {

    private final EventTypeService eventTypeService;
    private final ResourceAggregator aggregator;
    private final PaginationPolicy paginationPolicy;
    private final String basePath;

    public EventTypeController(
            EventTypeService eventTypeService,
            ResourceAggregator aggregator,
            PaginationPolicy paginationPolicy,
            RepresentationSelector selector) {
        this.eventTypeService = eventTypeService;
        this.aggregator = aggregator;
        this.paginationPolicy = paginationPolicy;
        this.basePath = selector.basePath();
    }

    /**
     * Create an event type.
     */
    @PostMapping
    public ResponseEntity<ApiResponse<Map<String, Object>>> createEventType(
            @RequestBody CreateEventTypeRequest request) {
        
        EventType eventType = eventTypeService.createEventType(
            request.category(), request.state(), request.description());
        
        return ResponseEntity.created(URI.create(eventType.href(basePath)))
            .body(ApiResponse.ok(eventType.toDict(basePath)));
    }

    /**
     * List event types, optionally filtered by category and state.
     */
    @GetMapping
    public ResponseEntity<ApiResponse<EventTypeListResponse>> listEventTypes(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String offset,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) List<String> expand) {
        
        PageRequest page = paginationPolicy.resolve(offset, limit, expand);
        EventTypeState parsedState = state != null ? EventTypeState.fromValue(state) : null;
        PagedResult<EventType> eventTypes = eventTypeService.queryEventTypes(
            new EventTypeQuery(category, parsedState), page);
        
        return ResponseEntity.ok(ApiResponse.ok(new EventTypeListResponse(
            page.limit(),
            page.offset(),
            eventTypes.total(),
            eventTypes.items().stream().map(t -> t.toDict(basePath)).toList()
        )));
    }

    /**
     * Get an event type with its events and fates.
     */
    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<EventTypeDocument>> getEventType(
            @PathVariable long id,
            @RequestParam(required = false) String offset,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) List<String> expand) {
        
        PageRequest page = paginationPolicy.resolve(offset, limit, expand);
        return ResponseEntity.ok(ApiResponse.ok(aggregator.renderEventType(id, page)));
    }

    /**
     * Change the description of an event type.
     */
    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> updateEventType(
            @PathVariable long id,
            @RequestBody UpdateEventTypeRequest request) {
        
        EventType eventType = eventTypeService.updateEventType(id, request.description());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("eventType", eventType.toDict(basePath))));
    }

    /**
     * Event types cannot be deleted; the request succeeds without changing anything.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteEventType(@PathVariable long id) {
        DeleteResult result = eventTypeService.deleteEventType(id);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("message", result.message())));
    }

    // ========== DTOs ==========

    public record CreateEventTypeRequest(
        String category,
        String state,
        String description
    ) {}

    public record UpdateEventTypeRequest(String description) {}

    public record EventTypeListResponse(
        int limit,
        int offset,
        long totalEventTypes,
        List<Map<String, Object>> eventTypes
    ) {}
}

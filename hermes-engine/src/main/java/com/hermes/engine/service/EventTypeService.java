package com.hermes.engine.service;

import com.hermes.core.exception.ConflictException;
import com.hermes.core.exception.NotFoundException;
import com.hermes.core.exception.ValidationException;
import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.repository.EventTypeRepository;
import com.hermes.core.repository.EventTypeRepository.EventTypeQuery;
import com.hermes.engine.logging.LoggingContext;
import com.hermes.engine.metrics.HermesMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maintains the event type catalog.
 * Category and state are fixed at creation. Deletes are declined.
 */
@Service
public class EventTypeService {

    private static final Logger log = LoggerFactory.getLogger(EventTypeService.class);

    static final String DELETE_NOT_SUPPORTED = "Not supported.";

    private final EventTypeRepository eventTypeRepository;
    private final HermesMetrics metrics;

    public EventTypeService(EventTypeRepository eventTypeRepository, HermesMetrics metrics) {
        this.eventTypeRepository = eventTypeRepository;
        this.metrics = metrics;
    }

    /**
     * Create an event type.
     * 
     * @throws ValidationException if any argument is missing or state is unknown
     * @throws ConflictException if (category, state) already exists
     */
    @Transactional
    public EventType createEventType(String category, String state, String description) {
        require("category", category);
        require("state", state);
        require("description", description);
        EventTypeState parsedState = EventTypeState.fromValue(state);

        EventType eventType;
        try {
            eventType = eventTypeRepository.create(EventType.create(category, parsedState, description));
        } catch (DataIntegrityViolationException e) {
            String message = e.getMostSpecificCause().getMessage();
            metrics.conflict("eventtype");
            log.warn("Event type {}/{} rejected by storage: {}", category, state, message);
            throw new ConflictException(message, e);
        }
        try (var ctx = LoggingContext.forEventType(eventType.id(), "create")) {
            metrics.mutation("eventtype", "create");
            log.info("Created event type {}/{}", category, state);
        }
        return eventType;
    }

    /**
     * Replace the description of an event type. Category and state are untouched.
     * 
     * @throws NotFoundException if the event type does not exist
     * @throws ValidationException if description is missing
     */
    @Transactional
    public EventType updateEventType(long eventTypeId, String description) {
        getEventType(eventTypeId);
        if (description == null) {
            throw ValidationException.missingArgument("description");
        }
        try (var ctx = LoggingContext.forEventType(eventTypeId, "update")) {
            EventType updated = eventTypeRepository.updateDescription(eventTypeId, description);
            metrics.mutation("eventtype", "update");
            log.info("Updated description of event type {}", eventTypeId);
            return updated;
        }
    }

    /**
     * Event types cannot be deleted. Always declines without touching storage,
     * whether or not the id exists.
     */
    public DeleteResult deleteEventType(long eventTypeId) {
        try (var ctx = LoggingContext.forEventType(eventTypeId, "delete")) {
            log.info("Declined delete of event type {}", eventTypeId);
            return DeleteResult.declined(DELETE_NOT_SUPPORTED);
        }
    }

    @Transactional(readOnly = true)
    public EventType getEventType(long eventTypeId) {
        return eventTypeRepository.findById(eventTypeId)
            .orElseThrow(() -> new NotFoundException("EventType", eventTypeId));
    }

    @Transactional(readOnly = true)
    public PagedResult<EventType> queryEventTypes(EventTypeQuery query, PageRequest page) {
        return PagedResult.of(
            eventTypeRepository.find(query, page.offset(), page.limit()),
            eventTypeRepository.count(query),
            page);
    }

    private static void require(String argument, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingArgument(argument);
        }
    }
}

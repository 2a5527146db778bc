package com.hermes.core.repository;

import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the event type catalog.
 * Event types are never deleted.
 */
public interface EventTypeRepository {

    /**
     * Store a new event type and assign its id.
     * 
     * @throws org.springframework.dao.DataIntegrityViolationException if (category, state) already exists
     */
    EventType create(EventType eventType);

    /**
     * Persist a new description. Category and state are never written.
     */
    EventType updateDescription(long eventTypeId, String description);

    Optional<EventType> findById(long eventTypeId);

    /**
     * Find event types matching the query, ordered by id.
     */
    List<EventType> find(EventTypeQuery query, int offset, int limit);

    long count(EventTypeQuery query);

    /**
     * Filter criteria for event types. Null fields match everything.
     */
    record EventTypeQuery(String category, EventTypeState state) {

        public static EventTypeQuery all() {
            return new EventTypeQuery(null, null);
        }

        public boolean matches(EventType eventType) {
            return (category == null || category.equals(eventType.category()))
                && (state == null || state == eventType.state());
        }
    }
}

package com.hermes.core.repository;

import com.hermes.core.model.Event;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Event persistence.
 * Events are append-only and immutable.
 * 
 * All listings are returned in timestamp order, then id order, oldest first.
 * The "recent" windows are cut from the newest end of the log.
 */
public interface EventRepository {

    /**
     * Append a new event and assign its id.
     * 
     * @throws org.springframework.dao.DataIntegrityViolationException if the host or event type does not exist
     */
    Event append(Event event);

    Optional<Event> findById(long eventId);

    /**
     * Get a window of the most recent events reported against a host.
     * Offset 0 starts at the newest event.
     * 
     * @param hostId The host id
     * @param offset Newest rows to skip
     * @param limit Maximum number of results
     * @return The window, oldest first
     */
    List<Event> findRecentByHost(long hostId, int offset, int limit);

    /**
     * Get the most recent event for a host, independent of any window.
     * Among events sharing the latest timestamp the highest id wins.
     */
    Optional<Event> findLatestByHost(long hostId);

    /**
     * Get a window of the most recent events of one type, oldest first.
     */
    List<Event> findRecentByEventType(long eventTypeId, int offset, int limit);

    List<Event> find(EventQuery query, int offset, int limit);

    long count(EventQuery query);

    /**
     * Check if any event references the host.
     */
    boolean existsByHost(long hostId);

    /**
     * Filter criteria for events. Null fields match everything.
     */
    record EventQuery(Long hostId, Long eventTypeId) {

        public boolean matches(Event event) {
            return (hostId == null || hostId == event.hostId())
                && (eventTypeId == null || eventTypeId == event.eventTypeId());
        }
    }
}

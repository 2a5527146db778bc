package com.hermes.engine.persistence;

import com.hermes.core.model.Event;
import com.hermes.core.repository.EventRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * In-memory implementation of EventRepository.
 * Host and event type references are not checked on append.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryEventRepository implements EventRepository {

    static final Comparator<Event> CHRONOLOGICAL =
        Comparator.comparing(Event::timestamp).thenComparingLong(Event::id);
    
    private final Map<Long, Event> events = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    
    @Override
    public Event append(Event event) {
        Event stored = event.withId(ids.incrementAndGet());
        events.put(stored.id(), stored);
        return stored;
    }
    
    @Override
    public Optional<Event> findById(long eventId) {
        return Optional.ofNullable(events.get(eventId));
    }
    
    @Override
    public List<Event> findRecentByHost(long hostId, int offset, int limit) {
        return recentWindow(events.values().stream().filter(e -> e.hostId() == hostId), offset, limit);
    }
    
    @Override
    public Optional<Event> findLatestByHost(long hostId) {
        return events.values().stream()
            .filter(e -> e.hostId() == hostId)
            .max(CHRONOLOGICAL);
    }
    
    @Override
    public List<Event> findRecentByEventType(long eventTypeId, int offset, int limit) {
        return recentWindow(events.values().stream().filter(e -> e.eventTypeId() == eventTypeId), offset, limit);
    }
    
    @Override
    public List<Event> find(EventQuery query, int offset, int limit) {
        return window(events.values().stream().filter(query::matches), offset, limit);
    }
    
    @Override
    public long count(EventQuery query) {
        return events.values().stream()
            .filter(query::matches)
            .count();
    }
    
    @Override
    public boolean existsByHost(long hostId) {
        return events.values().stream().anyMatch(e -> e.hostId() == hostId);
    }

    private static List<Event> window(Stream<Event> matching, int offset, int limit) {
        return matching
            .sorted(CHRONOLOGICAL)
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }

    private static List<Event> recentWindow(Stream<Event> matching, int offset, int limit) {
        List<Event> window = matching
            .sorted(CHRONOLOGICAL.reversed())
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
        Collections.reverse(window);
        return window;
    }
}

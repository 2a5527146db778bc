package com.hermes.engine.persistence;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.EventType;
import com.hermes.core.repository.EventTypeRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventTypeRepository.
 * (category, state) is unique.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryEventTypeRepository implements EventTypeRepository {
    
    private final Map<Long, EventType> eventTypes = new ConcurrentHashMap<>();
    private final Map<String, Long> byCategoryAndState = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    
    @Override
    public EventType create(EventType eventType) {
        long id = ids.incrementAndGet();
        String key = eventType.category() + "/" + eventType.state().value();
        if (byCategoryAndState.putIfAbsent(key, id) != null) {
            throw new DuplicateKeyException(
                "Duplicate entry '" + key + "' for key 'event_types.category_state'");
        }
        EventType stored = eventType.withId(id);
        eventTypes.put(id, stored);
        return stored;
    }
    
    @Override
    public EventType updateDescription(long eventTypeId, String description) {
        EventType updated = eventTypes.computeIfPresent(eventTypeId,
            (id, existing) -> existing.withDescription(description));
        if (updated == null) {
            throw new NotFoundException("EventType", eventTypeId);
        }
        return updated;
    }
    
    @Override
    public Optional<EventType> findById(long eventTypeId) {
        return Optional.ofNullable(eventTypes.get(eventTypeId));
    }
    
    @Override
    public List<EventType> find(EventTypeQuery query, int offset, int limit) {
        return eventTypes.values().stream()
            .filter(query::matches)
            .sorted(Comparator.comparingLong(EventType::id))
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public long count(EventTypeQuery query) {
        return eventTypes.values().stream()
            .filter(query::matches)
            .count();
    }
}

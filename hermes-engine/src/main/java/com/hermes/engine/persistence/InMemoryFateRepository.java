package com.hermes.engine.persistence;

import com.hermes.core.model.Fate;
import com.hermes.core.repository.FateRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of FateRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryFateRepository implements FateRepository {
    
    private final Map<Long, Fate> fates = new ConcurrentHashMap<>();

    public void save(Fate fate) {
        fates.put(fate.id(), fate);
    }
    
    @Override
    public List<Fate> findAssociated(long eventTypeId) {
        return fates.values().stream()
            .filter(f -> f.creationEventTypeId() == eventTypeId || f.completionEventTypeId() == eventTypeId)
            .sorted(Comparator.comparingLong(Fate::id))
            .collect(Collectors.toList());
    }
}

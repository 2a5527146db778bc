package com.hermes.engine.persistence;

import com.hermes.core.model.Labor;
import com.hermes.core.repository.LaborRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of LaborRepository.
 * Labors are loaded through {@link #save(Labor)} by whoever owns the workflow.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryLaborRepository implements LaborRepository {
    
    private final Map<Long, Labor> labors = new ConcurrentHashMap<>();

    public void save(Labor labor) {
        labors.put(labor.id(), labor);
    }
    
    @Override
    public Optional<Labor> findById(long laborId) {
        return Optional.ofNullable(labors.get(laborId));
    }
    
    @Override
    public List<Labor> findByHost(long hostId, int offset, int limit) {
        return labors.values().stream()
            .filter(l -> l.hostId() == hostId)
            .sorted(Comparator.comparing(Labor::creationTime).thenComparingLong(Labor::id))
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public boolean existsByHost(long hostId) {
        return labors.values().stream().anyMatch(l -> l.hostId() == hostId);
    }
}

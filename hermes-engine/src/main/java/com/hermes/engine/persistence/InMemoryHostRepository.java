package com.hermes.engine.persistence;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.Host;
import com.hermes.core.repository.EventRepository;
import com.hermes.core.repository.HostRepository;
import com.hermes.core.repository.LaborRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory implementation of HostRepository.
 * The hostname index is claimed atomically, so uniqueness holds under
 * concurrent writers the same way a unique constraint would.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "memory", matchIfMissing = true)
public class InMemoryHostRepository implements HostRepository {
    
    private final Map<Long, Host> hosts = new ConcurrentHashMap<>();
    private final Map<String, Long> byHostname = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    private final EventRepository eventRepository;
    private final LaborRepository laborRepository;

    public InMemoryHostRepository(EventRepository eventRepository, LaborRepository laborRepository) {
        this.eventRepository = eventRepository;
        this.laborRepository = laborRepository;
    }
    
    @Override
    public Host create(Host host) {
        long id = ids.incrementAndGet();
        claimHostname(host.hostname(), id);
        Host stored = host.withId(id);
        hosts.put(id, stored);
        return stored;
    }
    
    @Override
    public Host update(Host host) {
        Host existing = hosts.get(host.id());
        if (existing == null) {
            throw new NotFoundException("Host", host.id());
        }
        if (existing.hostname().equals(host.hostname())) {
            return existing;
        }
        claimHostname(host.hostname(), host.id());
        hosts.put(host.id(), host);
        byHostname.remove(existing.hostname(), host.id());
        return host;
    }
    
    @Override
    public void delete(long hostId) {
        Host existing = hosts.get(hostId);
        if (existing == null) {
            throw new NotFoundException("Host", hostId);
        }
        if (eventRepository.existsByHost(hostId)) {
            throw new DataIntegrityViolationException(
                "Host " + existing.hostname() + " is still referenced from table events");
        }
        if (laborRepository.existsByHost(hostId)) {
            throw new DataIntegrityViolationException(
                "Host " + existing.hostname() + " is still referenced from table labors");
        }
        hosts.remove(hostId);
        byHostname.remove(existing.hostname(), hostId);
    }
    
    @Override
    public Optional<Host> findById(long hostId) {
        return Optional.ofNullable(hosts.get(hostId));
    }
    
    @Override
    public Optional<Host> findByHostname(String hostname) {
        Long id = byHostname.get(hostname);
        return id == null ? Optional.empty() : findById(id);
    }
    
    @Override
    public List<Host> find(HostQuery query, int offset, int limit) {
        return hosts.values().stream()
            .filter(query::matches)
            .sorted(Comparator.comparingLong(Host::id))
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }
    
    @Override
    public long count(HostQuery query) {
        return hosts.values().stream()
            .filter(query::matches)
            .count();
    }

    private void claimHostname(String hostname, long id) {
        Long holder = byHostname.putIfAbsent(hostname, id);
        if (holder != null) {
            throw new DuplicateKeyException(
                "Duplicate entry '" + hostname + "' for key 'hosts.hostname'");
        }
    }
}

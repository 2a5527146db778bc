package com.hermes.engine.service;

import com.hermes.core.exception.ConflictException;
import com.hermes.core.exception.NotFoundException;
import com.hermes.core.exception.ValidationException;
import com.hermes.core.model.Host;
import com.hermes.core.pagination.PageRequest;
import com.hermes.core.repository.HostRepository;
import com.hermes.core.repository.HostRepository.HostQuery;
import com.hermes.engine.logging.LoggingContext;
import com.hermes.engine.metrics.HermesMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Create, rename, delete and look up hosts.
 * 
 * Hostname uniqueness and referential integrity are left to storage;
 * constraint violations come back as {@link ConflictException}.
 */
@Service
public class HostService {

    private static final Logger log = LoggerFactory.getLogger(HostService.class);

    private final HostRepository hostRepository;
    private final HermesMetrics metrics;

    public HostService(HostRepository hostRepository, HermesMetrics metrics) {
        this.hostRepository = hostRepository;
        this.metrics = metrics;
    }

    /**
     * Create a host.
     * 
     * @throws ValidationException if hostname is missing or empty
     * @throws ConflictException if the hostname already exists
     */
    @Transactional
    public Host createHost(String hostname) {
        requireHostname(hostname);
        try (var ctx = LoggingContext.forHost(hostname, "create")) {
            Host host;
            try {
                host = hostRepository.create(Host.create(hostname));
            } catch (DataIntegrityViolationException e) {
                throw conflict(e);
            }
            metrics.mutation("host", "create");
            log.info("Created host {} (id={})", host.hostname(), host.id());
            return host;
        }
    }

    /**
     * Rename a host.
     * 
     * @throws NotFoundException if no host has the current hostname
     * @throws ValidationException if the new hostname is missing or empty
     * @throws ConflictException if the new hostname is taken
     */
    @Transactional
    public Host updateHost(String hostname, String newHostname) {
        Host host = getHost(hostname);
        requireHostname(newHostname);
        try (var ctx = LoggingContext.forHost(hostname, "update")) {
            Host updated;
            try {
                updated = hostRepository.update(host.withHostname(newHostname));
            } catch (DataIntegrityViolationException e) {
                throw conflict(e);
            }
            metrics.mutation("host", "update");
            log.info("Renamed host {} to {}", hostname, newHostname);
            return updated;
        }
    }

    /**
     * Delete a host. Hosts still referenced by events or labors are not
     * cascaded; the delete fails instead.
     * 
     * @throws NotFoundException if the host does not exist
     * @throws ConflictException if other records reference the host
     */
    @Transactional
    public DeleteResult deleteHost(String hostname) {
        Host host = getHost(hostname);
        try (var ctx = LoggingContext.forHost(hostname, "delete")) {
            try {
                hostRepository.delete(host.id());
            } catch (DataIntegrityViolationException e) {
                throw conflict(e);
            }
            metrics.mutation("host", "delete");
            log.info("Deleted host {}", hostname);
            return DeleteResult.deleted("Host " + hostname + " deleted.");
        }
    }

    @Transactional(readOnly = true)
    public Host getHost(String hostname) {
        return hostRepository.findByHostname(hostname)
            .orElseThrow(() -> new NotFoundException("Host", hostname));
    }

    @Transactional(readOnly = true)
    public PagedResult<Host> queryHosts(HostQuery query, PageRequest page) {
        return PagedResult.of(
            hostRepository.find(query, page.offset(), page.limit()),
            hostRepository.count(query),
            page);
    }

    private static void requireHostname(String hostname) {
        if (hostname == null || hostname.isBlank()) {
            throw ValidationException.missingArgument("hostname");
        }
    }

    private ConflictException conflict(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        metrics.conflict("host");
        log.warn("Host write rejected by storage: {}", message);
        return new ConflictException(message, e);
    }
}

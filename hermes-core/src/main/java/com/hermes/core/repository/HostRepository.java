package com.hermes.core.repository;

import com.hermes.core.model.Host;
import java.util.List;
import java.util.Optional;

/**
 * Repository for Host persistence.
 * Hostname uniqueness is enforced here, not by callers.
 */
public interface HostRepository {

    /**
     * Store a new host and assign its id.
     * 
     * @param host The host to create
     * @return The stored host with id assigned
     * @throws org.springframework.dao.DataIntegrityViolationException if the hostname is taken
     */
    Host create(Host host);

    /**
     * Rename an existing host.
     * 
     * @param host The host carrying its existing id and new hostname
     * @throws org.springframework.dao.DataIntegrityViolationException if the new hostname is taken
     */
    Host update(Host host);

    /**
     * Delete a host.
     * 
     * @param hostId The host id
     * @throws org.springframework.dao.DataIntegrityViolationException if events or labors still reference the host
     */
    void delete(long hostId);

    Optional<Host> findById(long hostId);

    /**
     * Find a host by its unique hostname.
     */
    Optional<Host> findByHostname(String hostname);

    /**
     * Find hosts matching the query, ordered by id.
     * 
     * @param query Filter criteria
     * @param offset Rows to skip
     * @param limit Maximum number of results
     * @return Matching hosts
     */
    List<Host> find(HostQuery query, int offset, int limit);

    /**
     * Count hosts matching the query.
     */
    long count(HostQuery query);

    /**
     * Filter criteria for hosts. Null fields match everything.
     */
    record HostQuery(String hostname) {

        public static HostQuery all() {
            return new HostQuery(null);
        }

        public boolean matches(Host host) {
            return hostname == null || hostname.equals(host.hostname());
        }
    }
}

package com.hermes.engine.persistence.jdbc;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.Host;
import com.hermes.core.repository.HostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of HostRepository.
 * Hostname uniqueness and foreign keys from events and labors are database
 * constraints; violations surface as Spring DataIntegrityViolationExceptions.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcHostRepository implements HostRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcHostRepository.class);

    private static final RowMapper<Host> ROW_MAPPER =
        (rs, rowNum) -> new Host(rs.getLong("id"), rs.getString("hostname"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcHostRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Host create(Host host) {
        long id = JdbcSupport.insertReturningId(jdbcTemplate,
            "INSERT INTO hosts (hostname) VALUES (?)", host.hostname());
        log.debug("Inserted host {} with id {}", host.hostname(), id);
        return host.withId(id);
    }

    @Override
    public Host update(Host host) {
        int rows = jdbcTemplate.update("UPDATE hosts SET hostname = ? WHERE id = ?",
            host.hostname(), host.id());
        if (rows == 0) {
            throw new NotFoundException("Host", host.id());
        }
        return host;
    }

    @Override
    public void delete(long hostId) {
        int rows = jdbcTemplate.update("DELETE FROM hosts WHERE id = ?", hostId);
        if (rows == 0) {
            throw new NotFoundException("Host", hostId);
        }
    }

    @Override
    public Optional<Host> findById(long hostId) {
        List<Host> results = jdbcTemplate.query("SELECT * FROM hosts WHERE id = ?", ROW_MAPPER, hostId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<Host> findByHostname(String hostname) {
        List<Host> results = jdbcTemplate.query("SELECT * FROM hosts WHERE hostname = ?", ROW_MAPPER, hostname);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Host> find(HostQuery query, int offset, int limit) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM hosts" + where(query, params) + " ORDER BY id ASC LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql, ROW_MAPPER, params.toArray());
    }

    @Override
    public long count(HostQuery query) {
        List<Object> params = new ArrayList<>();
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM hosts" + where(query, params), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    private static String where(HostQuery query, List<Object> params) {
        if (query.hostname() == null) {
            return "";
        }
        params.add(query.hostname());
        return " WHERE hostname = ?";
    }
}

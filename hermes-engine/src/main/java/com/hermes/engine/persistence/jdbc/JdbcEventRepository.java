package com.hermes.engine.persistence.jdbc;

import com.hermes.core.model.Event;
import com.hermes.core.repository.EventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of EventRepository.
 * Events are append-only; listings come back oldest first.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcEventRepository implements EventRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventRepository.class);

    private static final RowMapper<Event> ROW_MAPPER = (rs, rowNum) -> new Event(
        rs.getLong("id"),
        rs.getLong("host_id"),
        rs.getLong("event_type_id"),
        JdbcSupport.getInstant(rs, "event_timestamp"),
        rs.getString("user_name"),
        rs.getString("note")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Event append(Event event) {
        String sql = """
            INSERT INTO events (host_id, event_type_id, event_timestamp, user_name, note)
            VALUES (?, ?, ?, ?, ?)
            """;
        long id = JdbcSupport.insertReturningId(jdbcTemplate, sql,
            event.hostId(),
            event.eventTypeId(),
            JdbcSupport.toTimestamp(event.timestamp()),
            event.user(),
            event.note()
        );
        log.debug("Appended event {} for host {}", id, event.hostId());
        return event.withId(id);
    }

    @Override
    public Optional<Event> findById(long eventId) {
        List<Event> results = jdbcTemplate.query("SELECT * FROM events WHERE id = ?", ROW_MAPPER, eventId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Event> findRecentByHost(long hostId, int offset, int limit) {
        return findRecent(new EventQuery(hostId, null), offset, limit);
    }

    @Override
    public Optional<Event> findLatestByHost(long hostId) {
        String sql = """
            SELECT * FROM events
            WHERE host_id = ?
            ORDER BY event_timestamp DESC, id DESC
            LIMIT 1
            """;
        List<Event> results = jdbcTemplate.query(sql, ROW_MAPPER, hostId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Event> findRecentByEventType(long eventTypeId, int offset, int limit) {
        return findRecent(new EventQuery(null, eventTypeId), offset, limit);
    }

    @Override
    public List<Event> find(EventQuery query, int offset, int limit) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM events" + where(query, params)
            + " ORDER BY event_timestamp ASC, id ASC LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql, ROW_MAPPER, params.toArray());
    }

    @Override
    public long count(EventQuery query) {
        List<Object> params = new ArrayList<>();
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM events" + where(query, params), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    @Override
    public boolean existsByHost(long hostId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM events WHERE host_id = ?)", Boolean.class, hostId);
        return Boolean.TRUE.equals(exists);
    }

    private List<Event> findRecent(EventQuery query, int offset, int limit) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM events" + where(query, params)
            + " ORDER BY event_timestamp DESC, id DESC LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);
        List<Event> window = new ArrayList<>(jdbcTemplate.query(sql, ROW_MAPPER, params.toArray()));
        Collections.reverse(window);
        return window;
    }

    private static String where(EventQuery query, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (query.hostId() != null) {
            clauses.add("host_id = ?");
            params.add(query.hostId());
        }
        if (query.eventTypeId() != null) {
            clauses.add("event_type_id = ?");
            params.add(query.eventTypeId());
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }
}

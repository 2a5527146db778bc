package com.hermes.engine.persistence.jdbc;

import com.hermes.core.exception.NotFoundException;
import com.hermes.core.model.EventType;
import com.hermes.core.model.EventTypeState;
import com.hermes.core.repository.EventTypeRepository;
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
 * PostgreSQL-backed implementation of EventTypeRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcEventTypeRepository implements EventTypeRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventTypeRepository.class);

    private static final RowMapper<EventType> ROW_MAPPER = (rs, rowNum) -> new EventType(
        rs.getLong("id"),
        rs.getString("category"),
        EventTypeState.fromValue(rs.getString("state")),
        rs.getString("description")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcEventTypeRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public EventType create(EventType eventType) {
        long id = JdbcSupport.insertReturningId(jdbcTemplate,
            "INSERT INTO event_types (category, state, description) VALUES (?, ?, ?)",
            eventType.category(), eventType.state().value(), eventType.description());
        log.debug("Inserted event type {}/{} with id {}",
            eventType.category(), eventType.state().value(), id);
        return eventType.withId(id);
    }

    @Override
    public EventType updateDescription(long eventTypeId, String description) {
        int rows = jdbcTemplate.update("UPDATE event_types SET description = ? WHERE id = ?",
            description, eventTypeId);
        if (rows == 0) {
            throw new NotFoundException("EventType", eventTypeId);
        }
        return findById(eventTypeId)
            .orElseThrow(() -> new NotFoundException("EventType", eventTypeId));
    }

    @Override
    public Optional<EventType> findById(long eventTypeId) {
        List<EventType> results = jdbcTemplate.query(
            "SELECT * FROM event_types WHERE id = ?", ROW_MAPPER, eventTypeId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<EventType> find(EventTypeQuery query, int offset, int limit) {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT * FROM event_types" + where(query, params) + " ORDER BY id ASC LIMIT ? OFFSET ?";
        params.add(limit);
        params.add(offset);
        return jdbcTemplate.query(sql, ROW_MAPPER, params.toArray());
    }

    @Override
    public long count(EventTypeQuery query) {
        List<Object> params = new ArrayList<>();
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM event_types" + where(query, params), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    private static String where(EventTypeQuery query, List<Object> params) {
        List<String> clauses = new ArrayList<>();
        if (query.category() != null) {
            clauses.add("category = ?");
            params.add(query.category());
        }
        if (query.state() != null) {
            clauses.add("state = ?");
            params.add(query.state().value());
        }
        return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
    }
}

package com.hermes.engine.persistence.jdbc;

import com.hermes.core.model.Labor;
import com.hermes.core.repository.LaborRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL-backed, read-only implementation of LaborRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcLaborRepository implements LaborRepository {

    private static final RowMapper<Labor> ROW_MAPPER = (rs, rowNum) -> new Labor(
        rs.getLong("id"),
        rs.getLong("host_id"),
        rs.getLong("quest_id"),
        rs.getLong("starting_event_id"),
        JdbcSupport.getNullableLong(rs, "completion_event_id"),
        JdbcSupport.getInstant(rs, "creation_time"),
        JdbcSupport.getInstant(rs, "completion_time"),
        rs.getString("ack_user"),
        JdbcSupport.getInstant(rs, "ack_time")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcLaborRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Labor> findById(long laborId) {
        List<Labor> results = jdbcTemplate.query("SELECT * FROM labors WHERE id = ?", ROW_MAPPER, laborId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Labor> findByHost(long hostId, int offset, int limit) {
        String sql = """
            SELECT * FROM labors
            WHERE host_id = ?
            ORDER BY creation_time ASC, id ASC
            LIMIT ? OFFSET ?
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, hostId, limit, offset);
    }

    @Override
    public boolean existsByHost(long hostId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM labors WHERE host_id = ?)", Boolean.class, hostId);
        return Boolean.TRUE.equals(exists);
    }
}

package com.hermes.engine.persistence.jdbc;

import com.hermes.core.model.Fate;
import com.hermes.core.repository.FateRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * PostgreSQL-backed, read-only implementation of FateRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcFateRepository implements FateRepository {

    private static final RowMapper<Fate> ROW_MAPPER = (rs, rowNum) -> new Fate(
        rs.getLong("id"),
        rs.getLong("creation_type_id"),
        rs.getLong("completion_type_id"),
        rs.getBoolean("intermediate"),
        rs.getString("description")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcFateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Fate> findAssociated(long eventTypeId) {
        String sql = """
            SELECT * FROM fates
            WHERE creation_type_id = ? OR completion_type_id = ?
            ORDER BY id ASC
            """;
        return jdbcTemplate.query(sql, ROW_MAPPER, eventTypeId, eventTypeId);
    }
}

package com.hermes.engine.persistence.jdbc;

import com.hermes.core.model.Quest;
import com.hermes.core.repository.QuestRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.*;

/**
 * PostgreSQL-backed, read-only implementation of QuestRepository.
 */
@Repository
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcQuestRepository implements QuestRepository {

    private static final RowMapper<Quest> ROW_MAPPER = (rs, rowNum) -> new Quest(
        rs.getLong("id"),
        rs.getString("creator"),
        rs.getString("description"),
        JdbcSupport.getInstant(rs, "embark_time"),
        JdbcSupport.getInstant(rs, "target_time"),
        JdbcSupport.getInstant(rs, "completion_time")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcQuestRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Quest> findById(long questId) {
        List<Quest> results = jdbcTemplate.query("SELECT * FROM quests WHERE id = ?", ROW_MAPPER, questId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Map<Long, Quest> findByIds(Collection<Long> questIds) {
        Set<Long> distinct = new LinkedHashSet<>(questIds);
        if (distinct.isEmpty()) {
            return Map.of();
        }
        String sql = "SELECT * FROM quests WHERE id IN (%s)".formatted(JdbcSupport.placeholders(distinct));
        Map<Long, Quest> found = new HashMap<>();
        for (Quest quest : jdbcTemplate.query(sql, ROW_MAPPER, distinct.toArray())) {
            found.put(quest.id(), quest);
        }
        return found;
    }
}

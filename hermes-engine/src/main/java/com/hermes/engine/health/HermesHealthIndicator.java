package com.hermes.engine.health;

import com.hermes.core.repository.EventTypeRepository;
import com.hermes.core.repository.EventTypeRepository.EventTypeQuery;
import com.hermes.core.repository.HostRepository;
import com.hermes.core.repository.HostRepository.HostQuery;
import com.hermes.engine.config.HermesProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Custom health indicator for Hermes.
 * Reports health status based on:
 * - Database connectivity (JDBC storage only)
 * - Catalog sizes
 */
@Component
public class HermesHealthIndicator implements HealthIndicator {

    private final HermesProperties properties;
    private final ObjectProvider<JdbcTemplate> jdbcTemplate;
    private final HostRepository hostRepository;
    private final EventTypeRepository eventTypeRepository;

    public HermesHealthIndicator(
            HermesProperties properties,
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            HostRepository hostRepository,
            EventTypeRepository eventTypeRepository) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.hostRepository = hostRepository;
        this.eventTypeRepository = eventTypeRepository;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("storage", properties.storage());
        
        try {
            JdbcTemplate jdbc = jdbcTemplate.getIfAvailable();
            if (jdbc != null && !checkDatabase(jdbc, details)) {
                return Health.down()
                    .withDetails(details)
                    .build();
            }

            details.put("hosts", hostRepository.count(HostQuery.all()));
            details.put("eventTypes", eventTypeRepository.count(EventTypeQuery.all()));

            return Health.up()
                .withDetails(details)
                .build();
                
        } catch (Exception e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(JdbcTemplate jdbc, Map<String, Object> details) {
        try {
            Integer result = jdbc.queryForObject("SELECT 1", Integer.class);
            details.put("database", "connected");
            return result != null && result == 1;
        } catch (Exception e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }
}

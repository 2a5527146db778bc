package com.hermes.engine.config;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * PostgreSQL storage, active when {@code hermes.storage=jdbc}.
 * In memory mode no DataSource exists and no transaction manager is registered.
 */
@Configuration
@ConditionalOnProperty(prefix = "hermes", name = "storage", havingValue = "jdbc")
public class JdbcStorageConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JdbcStorageConfiguration.class);

    @Bean
    public DataSource dataSource(HermesProperties properties) {
        HermesProperties.Jdbc jdbc = properties.jdbc();
        if (jdbc.url() == null || jdbc.url().isBlank()) {
            throw new IllegalStateException("hermes.jdbc.url is required when hermes.storage=jdbc");
        }
        log.info("Using JDBC storage at {}", jdbc.url());
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setJdbcUrl(jdbc.url());
        dataSource.setUsername(jdbc.username());
        dataSource.setPassword(jdbc.password());
        dataSource.setPoolName("hermes");
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public DataSourceInitializer schemaInitializer(DataSource dataSource, HermesProperties properties) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(schemaPopulator());
        initializer.setEnabled(properties.jdbc().initializeSchema());
        return initializer;
    }

    /**
     * Populator that runs {@code schema.sql}. Statements are idempotent.
     */
    public static ResourceDatabasePopulator schemaPopulator() {
        return new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
    }
}

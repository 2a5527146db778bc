package com.hermes.engine.config;

import com.hermes.core.pagination.PaginationPolicy;
import com.hermes.core.representation.RepresentationSelector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the request-shaping policies from {@link HermesProperties}.
 */
@Configuration
@EnableConfigurationProperties(HermesProperties.class)
public class HermesConfiguration {

    @Bean
    public PaginationPolicy paginationPolicy(HermesProperties properties) {
        return new PaginationPolicy(
            properties.pagination().defaultLimit(),
            properties.pagination().maxLimit());
    }

    @Bean
    public RepresentationSelector representationSelector(HermesProperties properties) {
        return new RepresentationSelector(properties.api().basePath());
    }
}

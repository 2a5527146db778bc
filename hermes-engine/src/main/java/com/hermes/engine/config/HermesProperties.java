package com.hermes.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings under the {@code hermes} prefix.
 * 
 * @param storage {@code memory} or {@code jdbc}
 * @param api HTTP surface settings
 * @param pagination page size bounds
 * @param jdbc connection settings, used when storage is {@code jdbc}
 */
@ConfigurationProperties(prefix = "hermes")
public record HermesProperties(
    @DefaultValue("memory") String storage,
    @DefaultValue Api api,
    @DefaultValue Pagination pagination,
    @DefaultValue Jdbc jdbc
) {
    public record Api(
        @DefaultValue("/api/v1") String basePath
    ) {}

    public record Pagination(
        @DefaultValue("10") int defaultLimit,
        @DefaultValue("100") int maxLimit
    ) {}

    public record Jdbc(
        String url,
        String username,
        String password,
        @DefaultValue("true") boolean initializeSchema
    ) {}
}

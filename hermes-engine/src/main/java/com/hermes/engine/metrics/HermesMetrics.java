package com.hermes.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Metrics for the Hermes API.
 * 
 * Metrics exposed:
 * - Mutation counts by entity and operation
 * - Storage conflicts by entity
 * - Composite document render latency
 */
public class HermesMetrics implements MeterBinder {

    // Metric names
    public static final String MUTATIONS = "hermes.mutations";
    public static final String CONFLICTS = "hermes.conflicts";
    public static final String RENDER_DURATION = "hermes.render.duration";

    // Until bound, meters go to a private registry
    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    public void mutation(String entity, String operation) {
        Counter.builder(MUTATIONS)
            .tag("entity", entity)
            .tag("operation", operation)
            .description("Successful create, update and delete operations")
            .register(registry)
            .increment();
    }

    public void conflict(String entity) {
        Counter.builder(CONFLICTS)
            .tag("entity", entity)
            .description("Writes rejected by storage constraints")
            .register(registry)
            .increment();
    }

    public void documentRendered(String document, Duration duration) {
        Timer.builder(RENDER_DURATION)
            .tag("document", document)
            .description("Composite document assembly time")
            .register(registry)
            .record(duration);
    }

    public MeterRegistry registry() {
        return registry;
    }
}

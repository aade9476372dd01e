/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.infra.metrics;

import java.time.Duration;

/**
 * Sink for the {@link RewriterMetric}s a run records.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register one under
 * {@code META-INF/services/com.essence.rewriter.infra.metrics.MetricsRegistry}. Without a
 * registration, {@link #getInstance()} returns a registry that drops everything.
 * Implementations must be thread-safe and have a public no-arg constructor.
 *
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.increment(RewriterMetric.RULE_APPLICATIONS, "partial_evaluator");
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Adds one to a counter.
     *
     * @param tagValues values for {@link RewriterMetric#tagKeys()}, in order
     * @throws IllegalArgumentException if {@code metric} is not a counter or the tags do not match
     */
    void increment(RewriterMetric metric, String... tagValues);

    /**
     * Records one observation of a timer.
     *
     * @throws IllegalArgumentException if {@code metric} is not a timer
     */
    void record(RewriterMetric metric, Duration duration);

    /**
     * The process-wide registry, discovered once on first use.
     */
    static MetricsRegistry getInstance() {
        return DiscoveredMetricsRegistry.INSTANCE;
    }

    /**
     * A registry that drops every observation.
     */
    static MetricsRegistry noop() {
        return NoOpMetricsRegistry.INSTANCE;
    }
}

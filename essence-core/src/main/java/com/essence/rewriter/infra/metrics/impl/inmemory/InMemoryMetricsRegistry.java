/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.infra.metrics.impl.inmemory;

import com.essence.rewriter.infra.metrics.MetricsRegistry;
import com.essence.rewriter.infra.metrics.RewriterMetric;
import com.essence.rewriter.infra.metrics.RewriterMetric.Kind;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;

/**
 * Registry that keeps every observation in memory, for assertions in tests.
 *
 * <p>Each tag combination is its own series, keyed by {@link RewriterMetric#seriesKey(String...)}.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * Rewriter rewriter = new Rewriter(registry, tracer, metrics);
 * rewriter.rewrite(model, List.of("Minion"));
 *
 * assertThat(metrics.getCounterValue(RewriterMetric.STEPS)).isEqualTo(2L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();
    private final Map<String, List<Duration>> timers = new ConcurrentHashMap<>();

    @Override
    public void increment(RewriterMetric metric, String... tagValues) {
        requireKind(metric, Kind.COUNTER);
        counters.computeIfAbsent(metric.seriesKey(tagValues), key -> new LongAdder()).increment();
    }

    @Override
    public void record(RewriterMetric metric, Duration duration) {
        requireKind(metric, Kind.TIMER);
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot record negative duration for "
                    + metric.metricName() + ": " + duration);
        }
        timers.computeIfAbsent(metric.seriesKey(), key -> new CopyOnWriteArrayList<>()).add(duration);
    }

    // Test helper methods

    public long getCounterValue(RewriterMetric metric, String... tagValues) {
        LongAdder counter = counters.get(metric.seriesKey(tagValues));
        return counter != null ? counter.sum() : 0L;
    }

    public List<Duration> getTimerRecordings(RewriterMetric metric) {
        List<Duration> recordings = timers.get(metric.seriesKey());
        return recordings != null ? List.copyOf(recordings) : List.of();
    }

    public void reset() {
        counters.clear();
        timers.clear();
    }

    private static void requireKind(RewriterMetric metric, Kind expected) {
        if (metric.kind() != expected) {
            throw new IllegalArgumentException(metric.metricName() + " is a " + metric.kind()
                    + ", not a " + expected);
        }
    }
}

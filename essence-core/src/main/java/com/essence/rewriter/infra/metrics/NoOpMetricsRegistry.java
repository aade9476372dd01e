/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.infra.metrics;

import java.time.Duration;

enum NoOpMetricsRegistry implements MetricsRegistry {
    INSTANCE;

    @Override
    public void increment(RewriterMetric metric, String... tagValues) {
    }

    @Override
    public void record(RewriterMetric metric, Duration duration) {
    }
}

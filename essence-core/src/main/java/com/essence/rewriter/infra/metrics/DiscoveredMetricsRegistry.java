/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.infra.metrics;

import java.util.Iterator;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Lazy holder for the registry behind {@link MetricsRegistry#getInstance()}.
 */
final class DiscoveredMetricsRegistry {

    private static final Logger logger = Logger.getLogger(DiscoveredMetricsRegistry.class.getName());

    static final MetricsRegistry INSTANCE = discover();

    private DiscoveredMetricsRegistry() {
    }

    private static MetricsRegistry discover() {
        Iterator<MetricsRegistry> found = ServiceLoader.load(MetricsRegistry.class).iterator();
        if (!found.hasNext()) {
            logger.fine("No metrics registry registered, dropping rewriter metrics");
            return NoOpMetricsRegistry.INSTANCE;
        }
        MetricsRegistry registry = found.next();
        if (found.hasNext()) {
            logger.warning(String.format("Several metrics registries registered, using %s",
                    registry.getClass().getName()));
        } else {
            logger.info(String.format("Using metrics registry %s", registry.getClass().getName()));
        }
        return registry;
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.infra.metrics;

import java.util.List;

/**
 * Every metric the rewriter records, with its exported name and tag keys.
 *
 * <p>Tag values are passed positionally and must match {@link #tagKeys()}.
 */
public enum RewriterMetric {

    STEPS("rewriter_steps_total", Kind.COUNTER),
    RULE_APPLICATIONS("rewriter_rule_applications_total", Kind.COUNTER, "rule"),
    RULE_DECLINES("rewriter_rule_declines_total", Kind.COUNTER, "rule"),
    SKIPPED_SUBTREES("rewriter_skipped_subtrees_total", Kind.COUNTER, "rule"),
    RUN_DURATION("rewriter_run_duration", Kind.TIMER);

    public enum Kind {
        COUNTER,
        TIMER
    }

    private final String metricName;
    private final Kind kind;
    private final List<String> tagKeys;

    RewriterMetric(String metricName, Kind kind, String... tagKeys) {
        this.metricName = metricName;
        this.kind = kind;
        this.tagKeys = List.of(tagKeys);
    }

    public String metricName() {
        return metricName;
    }

    public Kind kind() {
        return kind;
    }

    public List<String> tagKeys() {
        return tagKeys;
    }

    /**
     * Series key of this metric for {@code tagValues}, as {@code name{k=v,...}}.
     *
     * @throws IllegalArgumentException if the number of values does not match the tag keys
     */
    public String seriesKey(String... tagValues) {
        if (tagValues.length != tagKeys.size()) {
            throw new IllegalArgumentException(String.format("%s takes tags %s but got %d values",
                    metricName, tagKeys, tagValues.length));
        }
        if (tagValues.length == 0) {
            return metricName;
        }
        StringBuilder sb = new StringBuilder(metricName).append('{');
        for (int i = 0; i < tagValues.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(tagKeys.get(i)).append('=').append(tagValues[i]);
        }
        return sb.append('}').toString();
    }
}

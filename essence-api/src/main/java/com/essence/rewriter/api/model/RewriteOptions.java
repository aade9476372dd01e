/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

import java.util.Objects;

/**
 * Per-run options of the rewriter.
 *
 * @param maxIterations   step cap; {@code 0} means unbounded
 * @param strategy        candidate ranking
 * @param cancellation    cooperative cancellation signal
 * @param extraRuleChecks after every step, verify shape preservation and that every
 *                        reference resolves
 * @param traceEnabled    record trace entries (the initial and final models are
 *                        always recorded)
 */
public record RewriteOptions(int maxIterations,
                             SelectionStrategy strategy,
                             CancellationToken cancellation,
                             boolean extraRuleChecks,
                             boolean traceEnabled) {

    public static final int DEFAULT_MAX_ITERATIONS = 10_000;

    public RewriteOptions {
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be >= 0, got: " + maxIterations);
        }
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(cancellation, "cancellation");
    }

    public static RewriteOptions defaults() {
        return new RewriteOptions(DEFAULT_MAX_ITERATIONS, SelectionStrategy.PRIORITY,
                CancellationToken.none(), false, true);
    }

    public RewriteOptions withMaxIterations(int max) {
        return new RewriteOptions(max, strategy, cancellation, extraRuleChecks, traceEnabled);
    }

    public RewriteOptions withStrategy(SelectionStrategy newStrategy) {
        return new RewriteOptions(maxIterations, newStrategy, cancellation, extraRuleChecks, traceEnabled);
    }

    public RewriteOptions withCancellation(CancellationToken token) {
        return new RewriteOptions(maxIterations, strategy, token, extraRuleChecks, traceEnabled);
    }

    public RewriteOptions withExtraRuleChecks(boolean enabled) {
        return new RewriteOptions(maxIterations, strategy, cancellation, enabled, traceEnabled);
    }

    public RewriteOptions withTraceEnabled(boolean enabled) {
        return new RewriteOptions(maxIterations, strategy, cancellation, extraRuleChecks, enabled);
    }

    public boolean isBounded() {
        return maxIterations > 0;
    }
}

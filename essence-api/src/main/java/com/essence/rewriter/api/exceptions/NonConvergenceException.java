/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.exceptions;

import com.essence.rewriter.api.model.RewriteTrace;

/**
 * Raised by {@link com.essence.rewriter.api.model.RewriteResult#orThrow()} when a run
 * hit its iteration cap with rules still applicable.
 *
 * <p>Carries the trace accumulated so far so callers can report it or retry
 * with a larger cap.
 */
public class NonConvergenceException extends RewriteException {

    private final transient RewriteTrace partialTrace;
    private final int maxIterations;

    public NonConvergenceException(int maxIterations, RewriteTrace partialTrace) {
        super("Rewriting did not converge within " + maxIterations + " steps");
        this.maxIterations = maxIterations;
        this.partialTrace = partialTrace;
    }

    public RewriteTrace getPartialTrace() {
        return partialTrace;
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}

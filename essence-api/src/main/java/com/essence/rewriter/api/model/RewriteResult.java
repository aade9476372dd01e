/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

import com.essence.rewriter.api.exceptions.NonConvergenceException;
import com.essence.rewriter.model.Model;

import java.util.List;

/**
 * Outcome of a rewrite run.
 *
 * @param outcome        how the run ended
 * @param model          the model as it stood when the run ended
 * @param trace          rewrites performed
 * @param steps          number of rewrites applied
 * @param durationNanos  wall-clock duration of the run
 * @param activeRuleSets resolved rule sets, in precedence order
 * @param maxIterations  cap the run was given ({@code 0} for none)
 */
public record RewriteResult(Outcome outcome,
                            Model model,
                            RewriteTrace trace,
                            int steps,
                            long durationNanos,
                            List<String> activeRuleSets,
                            int maxIterations) {

    public enum Outcome {
        /**
         * No rule applies; the model is final.
         */
        FIXED,

        /**
         * The step cap was reached while rules still applied.
         */
        DID_NOT_CONVERGE,

        /**
         * A cancellation token stopped the run between steps.
         */
        CANCELLED
    }

    public RewriteResult {
        activeRuleSets = List.copyOf(activeRuleSets);
    }

    public boolean isFixed() {
        return outcome == Outcome.FIXED;
    }

    /**
     * Returns this result if it reached a fixpoint or was cancelled.
     *
     * @throws NonConvergenceException if the run hit its step cap
     */
    public RewriteResult orThrow() {
        if (outcome == Outcome.DID_NOT_CONVERGE) {
            throw new NonConvergenceException(maxIterations, trace);
        }
        return this;
    }

    public double durationMillis() {
        return durationNanos / 1_000_000.0;
    }
}

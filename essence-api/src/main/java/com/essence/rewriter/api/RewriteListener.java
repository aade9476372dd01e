/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api;

import com.essence.rewriter.api.exceptions.RewriteException;
import com.essence.rewriter.api.model.RewriteState;
import com.essence.rewriter.api.model.TraceEntry;
import com.essence.rewriter.model.Model;

import java.util.List;

/**
 * Callback interface for rewrite progress.
 * Allows debuggers and monitoring systems to follow a run step by step.
 *
 * <p>Purely an observer: callbacks cannot influence rule selection.
 *
 * <h2>Usage</h2>
 * <pre>
 * RewriteListener listener = new RewriteListener() {
 *     {@literal @}Override
 *     public void onRuleApplied(TraceEntry entry) {
 *         System.out.printf("%d: %s%n", entry.step(), entry.ruleName());
 *     }
 * };
 * rewriter.setRewriteListener(listener);
 * </pre>
 */
public interface RewriteListener {

    /**
     * Called once before the first scan.
     *
     * @param model          the run's working copy
     * @param activeRuleSets resolved rule sets, in precedence order
     */
    default void onRewriteStart(Model model, List<String> activeRuleSets) {
    }

    /**
     * Called on every state transition.
     *
     * @param state the state entered
     * @param step  number of rewrites applied so far
     */
    default void onStateChange(RewriteState state, int step) {
    }

    /**
     * Called after a rewrite has been applied to the model.
     */
    default void onRuleApplied(TraceEntry entry) {
    }

    /**
     * Called when no rule applies any more.
     */
    default void onFixpoint(Model model, int steps) {
    }

    /**
     * Called when the run aborts with an error.
     *
     * @param step  the step being attempted
     * @param error the failure
     */
    default void onError(int step, RewriteException error) {
    }
}

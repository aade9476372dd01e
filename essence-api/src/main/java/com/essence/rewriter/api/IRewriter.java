/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api;

import com.essence.rewriter.api.model.RewriteOptions;
import com.essence.rewriter.api.model.RewriteResult;
import com.essence.rewriter.model.Model;

import io.opentelemetry.api.trace.Tracer;

import java.util.List;

/**
 * Contract for rewriting a model to a fixpoint under a selection of rule sets.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IRewriter rewriter = new Rewriter(RuleRegistry.getInstance(), tracer);
 * RewriteResult result = rewriter.rewrite(model, List.of("Minion")).orThrow();
 * System.out.println(result.model());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>One instance may serve concurrent runs on different models. A single run is
 * strictly sequential.
 */
public interface IRewriter {

    /**
     * Rewrites with {@link RewriteOptions#defaults()}.
     */
    default RewriteResult rewrite(Model model, List<String> ruleSets) {
        return rewrite(model, ruleSets, RewriteOptions.defaults());
    }

    /**
     * Rewrites a copy of {@code model} until no rule in the active rule sets applies,
     * the step cap is hit, or the run is cancelled. The caller's model is not modified.
     *
     * @param model    model to rewrite
     * @param ruleSets rule set names; dependencies are activated automatically
     * @param options  run options
     * @return the outcome with the resulting model and trace
     * @throws com.essence.rewriter.api.exceptions.RewriteException if a rule misbehaves
     */
    RewriteResult rewrite(Model model, List<String> ruleSets, RewriteOptions options);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener notified of run progress.
     *
     * @param listener the listener (null to disable)
     */
    default void setRewriteListener(RewriteListener listener) {
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine;

import com.essence.rewriter.api.IRewriter;
import com.essence.rewriter.api.RewriteListener;
import com.essence.rewriter.api.exceptions.MalformedReconstructionException;
import com.essence.rewriter.api.exceptions.RewriteException;
import com.essence.rewriter.api.exceptions.RuleApplicationException;
import com.essence.rewriter.api.exceptions.UnresolvedIdentifierException;
import com.essence.rewriter.api.model.RewriteOptions;
import com.essence.rewriter.api.model.RewriteResult;
import com.essence.rewriter.api.model.RewriteResult.Outcome;
import com.essence.rewriter.api.model.RewriteState;
import com.essence.rewriter.api.model.TraceEntry;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.Root;
import com.essence.rewriter.engine.trace.TraceRecorder;
import com.essence.rewriter.infra.metrics.MetricsRegistry;
import com.essence.rewriter.infra.metrics.RewriterMetric;
import com.essence.rewriter.model.Declaration;
import com.essence.rewriter.model.Model;
import com.essence.rewriter.model.SymbolTable;
import com.essence.rewriter.rule.Reduction;
import com.essence.rewriter.rule.RuleIgnoreException;
import com.essence.rewriter.rule.RuleNotApplicableException;
import com.essence.rewriter.rules.registry.RuleRegistry;
import com.essence.rewriter.term.Terms;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fixpoint rewriting engine.
 *
 * <p>Each iteration scans the whole model for applicable (subterm, rule) pairs,
 * ranks them with the run's {@link com.essence.rewriter.api.model.SelectionStrategy},
 * and applies the best one whose transform succeeds. The run ends when no rule
 * applies anywhere, when the step cap is reached, or when it is cancelled.
 *
 * <h2>State machine</h2>
 * <pre>
 * SCANNING --(candidate found)--&gt; APPLYING --&gt; SCANNING
 * SCANNING --(no candidate)-----&gt; FIXED
 * </pre>
 *
 * <h2>Failure atomicity</h2>
 * <p>A step is built entirely from immutable values: new root, appended
 * constraints and an extended copy of the symbol table. The working model is
 * updated only once all of them are in hand, so a failing step leaves it as it
 * was after the previous step.
 *
 * <h2>Thread Safety</h2>
 * <p>All per-run state lives on the stack of {@link #rewrite(Model, List, RewriteOptions)};
 * one instance may serve concurrent runs on different models.
 */
public final class Rewriter implements IRewriter {

    private static final Logger logger = LoggerFactory.getLogger(Rewriter.class);

    static final String SPAN_NAME = "rewrite-model";

    private static final AttributeKey<String> RULE_KEY = AttributeKey.stringKey("rule");
    private static final AttributeKey<Long> STEP_KEY = AttributeKey.longKey("step");
    private static final AttributeKey<String> PATH_KEY = AttributeKey.stringKey("path");

    private final RuleRegistry registry;
    private final MetricsRegistry metrics;
    private volatile Tracer tracer;
    private volatile RewriteListener listener;

    /**
     * Creates a Rewriter with the global metrics registry.
     *
     * @param registry rules available to runs
     * @param tracer   OpenTelemetry tracer for observability
     */
    public Rewriter(RuleRegistry registry, Tracer tracer) {
        this(registry, tracer, MetricsRegistry.getInstance());
    }

    public Rewriter(RuleRegistry registry, Tracer tracer, MetricsRegistry metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        logger.info("Rewriter initialized with {} rules in {} rule sets",
                registry.size(), registry.ruleSets().size());
    }

    /**
     * Creates a Rewriter with a no-op tracer.
     */
    public Rewriter(RuleRegistry registry) {
        this(registry, OpenTelemetry.noop().getTracer("essence-rewriter"));
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
    }

    @Override
    public void setRewriteListener(RewriteListener listener) {
        this.listener = listener;
    }

    // ========================================================================
    // RUN
    // ========================================================================

    @Override
    public RewriteResult rewrite(Model model, List<String> ruleSets, RewriteOptions options) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(ruleSets, "ruleSets must not be null");
        Objects.requireNonNull(options, "options must not be null");

        long startNanos = System.nanoTime();
        Span span = tracer.spanBuilder(SPAN_NAME).startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rewrite.rule_sets", String.join(",", ruleSets));
            span.setAttribute("rewrite.max_iterations", options.maxIterations());

            RewriteResult result = run(model, ruleSets, options, span, startNanos, listener);

            span.setAttribute("rewrite.steps", result.steps());
            span.setAttribute("rewrite.outcome", result.outcome().name());
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            metrics.record(RewriterMetric.RUN_DURATION, Duration.ofNanos(System.nanoTime() - startNanos));
            span.end();
        }
    }

    private RewriteResult run(Model input, List<String> configured, RewriteOptions options,
                              Span span, long startNanos, RewriteListener listener) {
        ActiveRules rules = ActiveRules.resolve(registry, configured);
        Model model = input.copy();
        TraceRecorder recorder = new TraceRecorder(options.traceEnabled());
        recorder.begin(model);

        logger.info("Rewriting model with {} constraints and {} declarations under rule sets {} ({} rules, strategy {})",
                model.constraints().size(), model.symbols().size(), rules.ruleSets(),
                rules.rules().size(), options.strategy());
        notify(listener, l -> l.onRewriteStart(model, rules.ruleSets()));

        int steps = 0;
        try {
            while (true) {
                if (options.cancellation().isCancelled()) {
                    logger.info("Rewriting cancelled after {} steps", steps);
                    return result(Outcome.CANCELLED, model, recorder, steps, startNanos, rules, options);
                }

                int current = steps;
                int step = steps + 1;
                notify(listener, l -> l.onStateChange(RewriteState.SCANNING, current));
                SkippedSubtrees skipped = new SkippedSubtrees();
                List<Candidate> candidates = CandidateScanner.scan(
                        model.root(), model.symbols(), rules, options.strategy(), step, skipped);
                Selection selection = select(candidates, model, step, skipped);
                for (String ruleName : skipped.ruleNames()) {
                    metrics.increment(RewriterMetric.SKIPPED_SUBTREES, ruleName);
                }

                if (selection == null) {
                    recorder.finalise(model);
                    notify(listener, l -> l.onStateChange(RewriteState.FIXED, current));
                    notify(listener, l -> l.onFixpoint(model, current));
                    RewriteResult result = result(Outcome.FIXED, model, recorder, steps, startNanos, rules, options);
                    logger.info("Rewriting reached a fixpoint after {} steps in {} ms",
                            steps, String.format("%.3f", result.durationMillis()));
                    return result;
                }

                if (options.isBounded() && steps >= options.maxIterations()) {
                    logger.warn("Rewriting did not converge within {} steps; '{}' still applies to '{}'",
                            options.maxIterations(), selection.candidate().ruleName(), selection.candidate().term());
                    return result(Outcome.DID_NOT_CONVERGE, model, recorder, steps, startNanos, rules, options);
                }

                notify(listener, l -> l.onStateChange(RewriteState.APPLYING, current));
                TraceEntry entry = apply(model, selection, step, options.extraRuleChecks());
                steps = step;

                recorder.record(entry);
                metrics.increment(RewriterMetric.STEPS);
                metrics.increment(RewriterMetric.RULE_APPLICATIONS, entry.ruleName());
                span.addEvent("apply-rule", Attributes.of(
                        RULE_KEY, entry.ruleName(),
                        STEP_KEY, (long) step,
                        PATH_KEY, entry.path().toString()));
                if (logger.isDebugEnabled()) {
                    logger.debug("Step {}: {} rewrote '{}' at {} to {}",
                            step, entry.ruleName(), entry.before(), entry.path(), entry.after());
                }
                notify(listener, l -> l.onRuleApplied(entry));
            }
        } catch (RewriteException e) {
            int failedStep = steps + 1;
            logger.error("Rewriting failed at step {}: {}", failedStep, e.getMessage());
            notify(listener, l -> l.onError(failedStep, e));
            throw e;
        }
    }

    // ========================================================================
    // SELECTION
    // ========================================================================

    /**
     * A candidate together with the reduction its transform produced.
     */
    private record Selection(Candidate candidate, Reduction reduction) {
    }

    /**
     * Tries the candidates best first; the first transform that does not decline wins.
     * A transform that throws {@link RuleIgnoreException} also withdraws the later
     * candidates inside the region it names.
     *
     * @return the winning selection, or {@code null} if every candidate declined
     */
    private Selection select(List<Candidate> candidates, Model model, int step, SkippedSubtrees skipped) {
        for (Candidate candidate : candidates) {
            if (skipped.contains(candidate.subterm().path())) {
                continue;
            }
            try {
                Reduction reduction = candidate.rule().rule().apply(candidate.term(), model.symbols());
                return new Selection(candidate, Objects.requireNonNull(reduction, "reduction"));
            } catch (RuleNotApplicableException e) {
                logger.debug("Rule {} declined '{}': {}", candidate.ruleName(), candidate.term(), e.getMessage());
                metrics.increment(RewriterMetric.RULE_DECLINES, candidate.ruleName());
            } catch (RuleIgnoreException e) {
                logger.debug("Rule {} skipped '{}' at {} to depth {}: {}", candidate.ruleName(), candidate.term(),
                        candidate.subterm().path(), e.getDepth(), e.getMessage());
                skipped.skip(candidate.subterm().path(), candidate.ruleName(), e);
            } catch (RuntimeException e) {
                throw RuleFailures.withContext(e, candidate.ruleName(), candidate.term().toString(), step);
            }
        }
        return null;
    }

    // ========================================================================
    // APPLICATION
    // ========================================================================

    /**
     * Applies the selection to {@code model}. Nothing is written to the model unless
     * every part of the step succeeds.
     */
    private TraceEntry apply(Model model, Selection selection, int step, boolean extraRuleChecks) {
        Candidate candidate = selection.candidate();
        Reduction reduction = selection.reduction();
        String ruleName = candidate.ruleName();
        String term = candidate.term().toString();

        Root newRoot;
        try {
            Expression rebuilt = Terms.replaceAt(model.root(), candidate.subterm().path(),
                    reduction.replacement(), Root::new);
            newRoot = rebuilt instanceof Root root ? root : new Root(List.of(rebuilt));
        } catch (MalformedReconstructionException e) {
            throw e.withContext(ruleName, term, step);
        }
        newRoot = newRoot.append(reduction.newTopLevel());

        SymbolTable newSymbols = model.symbols();
        if (!reduction.newSymbols().isEmpty()) {
            newSymbols = newSymbols.copy();
            for (Declaration declaration : reduction.newSymbols()) {
                try {
                    newSymbols.declare(declaration);
                } catch (IllegalArgumentException e) {
                    throw new RuleApplicationException(ruleName, term, step, e);
                }
            }
        }

        if (extraRuleChecks) {
            verify(newRoot, newSymbols, ruleName, term, step);
        }

        model.update(newRoot, newSymbols);

        return new TraceEntry(step, candidate.term(), ruleName, candidate.rule().memberships(),
                reduction.replacement(), reduction.newTopLevel(), reduction.newSymbols(),
                candidate.subterm().path());
    }

    /**
     * Every node must rebuild to itself from its own children, and every reference
     * must resolve.
     */
    private static void verify(Root root, SymbolTable symbols, String ruleName, String term, int step) {
        for (Expression node : Terms.universe(root)) {
            Expression rebuilt;
            try {
                rebuilt = node.withChildren(node.children());
            } catch (MalformedReconstructionException e) {
                throw e.withContext(ruleName, term, step);
            }
            if (!rebuilt.equals(node)) {
                throw new MalformedReconstructionException("Node does not rebuild to itself: " + node)
                        .withContext(ruleName, term, step);
            }
        }
        try {
            symbols.validateReferences(root);
        } catch (UnresolvedIdentifierException e) {
            throw e.withContext(ruleName, term, step);
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private static RewriteResult result(Outcome outcome, Model model, TraceRecorder recorder, int steps,
                                        long startNanos, ActiveRules rules, RewriteOptions options) {
        return new RewriteResult(outcome, model, recorder.trace(), steps, System.nanoTime() - startNanos,
                rules.ruleSets(), options.maxIterations());
    }

    /**
     * Listener failures are logged and do not affect the run.
     */
    private static void notify(RewriteListener listener, Consumer<RewriteListener> callback) {
        if (listener == null) {
            return;
        }
        try {
            callback.accept(listener);
        } catch (RuntimeException e) {
            logger.warn("Rewrite listener failed: {}", e.getMessage(), e);
        }
    }
}

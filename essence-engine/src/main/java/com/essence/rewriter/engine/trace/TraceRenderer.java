/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine.trace;

import com.essence.rewriter.api.model.RewriteTrace;
import com.essence.rewriter.api.model.TraceEntry;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Declaration;
import com.essence.rewriter.rule.RuleSetMembership;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link RewriteTrace} as human-readable text.
 *
 * <pre>
 * Model before rewriting:
 *
 * find x: bool
 *
 * such that
 *
 * !(x)
 *
 * --
 *
 * !(x),
 *    ~~&gt; literal_to_watched_literal ([("Minion", 4100)])
 * WatchedLiteral(x,false)
 *
 * --
 *
 * Final model:
 *
 * ...
 * </pre>
 *
 * Lines after the rule name and the replacement end in a single space; consumers
 * compare this output byte for byte.
 */
public final class TraceRenderer {

    private static final String SEPARATOR = "\n--\n\n";

    private TraceRenderer() {
    }

    public static String render(RewriteTrace trace) {
        StringBuilder sb = new StringBuilder();
        sb.append("Model before rewriting:\n\n")
                .append(trace.initialModel())
                .append("\n")
                .append(SEPARATOR);

        for (TraceEntry entry : trace.entries()) {
            appendEntry(sb, entry);
        }

        trace.finalModel().ifPresent(model -> sb.append("Final model:\n\n").append(model).append("\n"));
        return sb.toString();
    }

    /**
     * One step, without the trailing separator.
     */
    public static String renderEntry(TraceEntry entry) {
        return entry.before() + ", \n"
                + "   ~~> " + entry.ruleName() + " (" + memberships(entry.ruleSets()) + ") \n"
                + joinExpressions(entry.after()) + " \n"
                + sideEffects(entry);
    }

    private static void appendEntry(StringBuilder sb, TraceEntry entry) {
        sb.append(renderEntry(entry)).append(SEPARATOR);
    }

    private static String memberships(List<RuleSetMembership> ruleSets) {
        return ruleSets.stream().map(RuleSetMembership::toString).collect(Collectors.joining(", ", "[", "]"));
    }

    private static String joinExpressions(List<Expression> expressions) {
        return expressions.stream().map(Expression::toString).collect(Collectors.joining(",\n"));
    }

    private static String sideEffects(TraceEntry entry) {
        StringBuilder sb = new StringBuilder();
        if (!entry.newTopLevel().isEmpty()) {
            sb.append("new constraints:\n").append(joinExpressions(entry.newTopLevel())).append("\n");
        }
        if (!entry.newSymbols().isEmpty()) {
            sb.append("new variables:\n")
                    .append(entry.newSymbols().stream().map(Declaration::toString).collect(Collectors.joining("\n")))
                    .append("\n");
        }
        return sb.toString();
    }
}

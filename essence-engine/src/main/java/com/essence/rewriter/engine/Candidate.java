/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine;

import com.essence.rewriter.api.model.SelectionStrategy;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.engine.ActiveRules.ActiveRule;
import com.essence.rewriter.term.Subterm;

import java.util.Comparator;

/**
 * A subterm paired with a rule whose condition accepted it.
 *
 * @param subterm        the matched subterm with its path
 * @param discoveryIndex position of the subterm in the pre-order scan
 * @param rule           the applicable rule
 */
record Candidate(Subterm<Expression> subterm, int discoveryIndex, ActiveRule rule) {

    private static final Comparator<Candidate> BY_PRIORITY =
            Comparator.comparing(Candidate::rule, Comparator.comparingInt(ActiveRule::priority).reversed())
                    .thenComparing(Candidate::rule, Comparator.comparingInt(ActiveRule::precedence))
                    .thenComparingInt(Candidate::discoveryIndex)
                    .thenComparing(Candidate::rule, Comparator.comparingInt(ActiveRule::registrationIndex));

    private static final Comparator<Candidate> BY_NODE =
            Comparator.comparingInt(Candidate::discoveryIndex)
                    .thenComparing(Candidate::rule, ActiveRules.RANK);

    static Comparator<Candidate> order(SelectionStrategy strategy) {
        return switch (strategy) {
            case PRIORITY -> BY_PRIORITY;
            case NODE_FIRST -> BY_NODE;
        };
    }

    Expression term() {
        return subterm.term();
    }

    String ruleName() {
        return rule.name();
    }
}

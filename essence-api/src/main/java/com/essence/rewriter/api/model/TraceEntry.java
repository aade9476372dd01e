/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Declaration;
import com.essence.rewriter.rule.RuleSetMembership;
import com.essence.rewriter.term.TermPath;

import java.util.List;

/**
 * One accepted rewrite.
 *
 * @param step            1-based step number
 * @param before          the matched subterm
 * @param ruleName        rule that rewrote it
 * @param ruleSets        every active (rule set, priority) pair of that rule, in configured order
 * @param after           the replacement terms
 * @param newTopLevel     constraints the rule appended to the root
 * @param newSymbols      auxiliary variables the rule declared
 * @param path            where {@code before} sat in the model
 */
public record TraceEntry(int step,
                         Expression before,
                         String ruleName,
                         List<RuleSetMembership> ruleSets,
                         List<Expression> after,
                         List<Expression> newTopLevel,
                         List<Declaration> newSymbols,
                         TermPath path) {

    public TraceEntry {
        ruleSets = List.copyOf(ruleSets);
        after = List.copyOf(after);
        newTopLevel = List.copyOf(newTopLevel);
        newSymbols = List.copyOf(newSymbols);
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Symbols;

/**
 * Applicability test of a rule. Must be a pure function of the subterm (and the
 * declarations it references); it may inspect the whole subtree but never the
 * term's position or the rewrite history.
 *
 * <p>Throwing {@link RuleIgnoreException} or {@link RulePruneException} withdraws the
 * term, and part or all of its subtree, from the current step.
 */
@FunctionalInterface
public interface RuleCondition {

    boolean test(Expression term, Symbols symbols);
}

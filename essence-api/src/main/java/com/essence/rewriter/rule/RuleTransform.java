/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Symbols;

/**
 * Transform of a rule, called only on terms its condition accepted.
 * May throw {@link RuleNotApplicableException} to decline after all, or
 * {@link RuleIgnoreException} to also withdraw the term from the current step.
 */
@FunctionalInterface
public interface RuleTransform {

    Reduction apply(Expression term, Symbols symbols);
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;

/**
 * Solver-native all-different over atoms only.
 */
public record FlatAllDiff(List<Expression> operands) implements Expression {

    public FlatAllDiff {
        operands = Expressions.requireAtoms("FlatAllDiff", operands);
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, operands.size());
        return new FlatAllDiff(children);
    }

    @Override
    public String toString() {
        return Expressions.join(operands, "__flat_alldiff([", "])");
    }
}

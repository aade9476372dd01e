/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.ArrayList;
import java.util.List;

/**
 * Solver-native linear constraint {@code sum(operands) <= bound} over atoms only.
 */
public record FlatSumLeq(List<Expression> operands, Expression bound) implements Expression {

    public FlatSumLeq {
        operands = Expressions.requireAtoms("FlatSumLeq", operands);
        Expressions.requireAtoms("FlatSumLeq", List.of(bound));
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(operands.size() + 1);
        children.addAll(operands);
        children.add(bound);
        return List.copyOf(children);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, operands.size() + 1);
        return new FlatSumLeq(children.subList(0, operands.size()), children.get(operands.size()));
    }

    @Override
    public String toString() {
        return Expressions.join(operands, "__flat_sumleq([", "],") + bound + ")";
    }
}

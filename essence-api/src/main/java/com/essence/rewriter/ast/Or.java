/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;

/**
 * Disjunction. Rebuilding keeps the arity, so conjuncts are never spliced into it.
 */
public record Or(List<Expression> operands) implements Expression {

    public Or {
        operands = List.copyOf(operands);
    }

    public static Or of(Expression... operands) {
        return new Or(List.of(operands));
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, operands.size());
        return new Or(children);
    }

    @Override
    public String toString() {
        return Expressions.join(operands, "or([", "])");
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import java.util.List;

/**
 * Conjunction. Variadic: a conjunct may be replaced by several conjuncts.
 */
public record And(List<Expression> operands) implements Expression {

    public And {
        operands = List.copyOf(operands);
    }

    public static And of(Expression... operands) {
        return new And(List.of(operands));
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new And(children);
    }

    @Override
    public boolean isVariadic() {
        return true;
    }

    @Override
    public String toString() {
        return Expressions.join(operands, "and([", "])");
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;

/**
 * Integer sum of its operands.
 */
public record Sum(List<Expression> operands) implements Expression {

    public Sum {
        operands = List.copyOf(operands);
    }

    public static Sum of(Expression... operands) {
        return new Sum(List.of(operands));
    }

    @Override
    public List<Expression> children() {
        return operands;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, operands.size());
        return new Sum(children);
    }

    @Override
    public String toString() {
        return Expressions.join(operands, "sum([", "])");
    }
}

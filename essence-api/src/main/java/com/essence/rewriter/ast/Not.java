/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;
import java.util.Objects;

public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, 1);
        return new Not(children.get(0));
    }

    @Override
    public String toString() {
        return "!(" + operand + ")";
    }
}

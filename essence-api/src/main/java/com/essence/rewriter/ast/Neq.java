/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;
import java.util.Objects;

/**
 * Disequality.
 */
public record Neq(Expression left, Expression right) implements Expression {

    public Neq {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, 2);
        return new Neq(children.get(0), children.get(1));
    }

    @Override
    public String toString() {
        return "(" + left + ") != (" + right + ")";
    }
}

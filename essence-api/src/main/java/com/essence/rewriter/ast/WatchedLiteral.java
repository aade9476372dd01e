/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;
import java.util.Objects;

/**
 * Solver-native literal constraint: boolean variable {@code name} takes {@code value}.
 */
public record WatchedLiteral(Name name, boolean value) implements Expression {

    public WatchedLiteral {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, 0);
        return this;
    }

    @Override
    public String toString() {
        return "WatchedLiteral(" + name + "," + value + ")";
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;

/**
 * Indivisible expression: a constant or a reference to a declared variable.
 */
public sealed interface Atom extends Expression permits BoolConstant, IntConstant, Reference {

    @Override
    default boolean isAtomic() {
        return true;
    }

    @Override
    default List<Expression> children() {
        return List.of();
    }

    @Override
    default Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, 0);
        return this;
    }
}

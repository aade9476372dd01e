/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level constraint list of a model: the conjunction of its constraints.
 *
 * <p>Variadic, so a rewrite can expand one constraint into several or drop it.
 * Printed one constraint per line, separated by commas.
 */
public record Root(List<Expression> constraints) implements Expression {

    public Root {
        constraints = List.copyOf(constraints);
    }

    public static Root of(Expression... constraints) {
        return new Root(List.of(constraints));
    }

    /**
     * New root with {@code extra} appended after the existing constraints.
     */
    public Root append(List<Expression> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<Expression> all = new ArrayList<>(constraints.size() + extra.size());
        all.addAll(constraints);
        all.addAll(extra);
        return new Root(all);
    }

    @Override
    public List<Expression> children() {
        return constraints;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new Root(children);
    }

    @Override
    public boolean isVariadic() {
        return true;
    }

    @Override
    public String toString() {
        return Expressions.join(constraints, ",\n", "", "");
    }
}

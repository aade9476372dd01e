/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Terms;

import java.util.List;
import java.util.Objects;

/**
 * One-dimensional matrix literal with an index domain annotation, printed
 * {@code [a, b, c;int(1..3)]}. The index domain is data, not a child.
 */
public record MatrixLiteral(List<Expression> elements, Domain index) implements Expression {

    public MatrixLiteral {
        elements = List.copyOf(elements);
        Objects.requireNonNull(index, "index");
    }

    /**
     * Matrix indexed from 1 with a bounded index domain covering the elements.
     */
    public static MatrixLiteral indexedFromOne(List<Expression> elements) {
        return new MatrixLiteral(elements, IntDomain.bounded(1, Math.max(1, elements.size())));
    }

    public MatrixLiteral withIndex(Domain newIndex) {
        return new MatrixLiteral(elements, newIndex);
    }

    @Override
    public List<Expression> children() {
        return elements;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        Terms.requireArity(this, children, elements.size());
        return new MatrixLiteral(children, index);
    }

    @Override
    public String toString() {
        return Expressions.join(elements, "[", ";" + index + "]");
    }
}

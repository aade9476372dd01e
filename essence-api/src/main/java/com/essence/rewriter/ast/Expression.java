/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.term.Term;

/**
 * Node of a constraint expression tree.
 *
 * <p>Every variant is an immutable record that owns its children exclusively and
 * declares them through {@link #children()}. Solver-native variants
 * ({@link WatchedLiteral}, {@link FlatAllDiff}, {@link FlatSumLeq}, {@link FlatSumGeq})
 * are ordinary variants as far as traversal is concerned.
 *
 * <p>{@link #toString()} is the Essence-like concrete syntax used in traces.
 */
public sealed interface Expression extends Term<Expression>
        permits Atom, Root, And, Or, Not, Iff, Eq, Neq, Leq, Sum, MatrixLiteral, AllDiff,
        WatchedLiteral, FlatAllDiff, FlatSumLeq, FlatSumGeq {

    /**
     * True for constants and references.
     */
    default boolean isAtomic() {
        return false;
    }
}

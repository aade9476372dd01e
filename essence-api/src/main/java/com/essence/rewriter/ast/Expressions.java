/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import com.essence.rewriter.api.exceptions.MalformedReconstructionException;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Factories and printing helpers shared by the expression variants.
 */
public final class Expressions {

    private Expressions() {
        throw new AssertionError("No instances");
    }

    public static Reference ref(String name) {
        return Reference.of(name);
    }

    public static BoolConstant bool(boolean value) {
        return BoolConstant.of(value);
    }

    public static IntConstant integer(int value) {
        return new IntConstant(value);
    }

    /**
     * Matrix literal {@code [e1, e2, ...;int(1..n)]}.
     */
    public static MatrixLiteral matrix(Expression... elements) {
        return MatrixLiteral.indexedFromOne(Arrays.asList(elements));
    }

    static String join(List<Expression> expressions, String prefix, String suffix) {
        return join(expressions, ", ", prefix, suffix);
    }

    static String join(List<Expression> expressions, String separator, String prefix, String suffix) {
        return expressions.stream()
                .map(Expression::toString)
                .collect(Collectors.joining(separator, prefix, suffix));
    }

    /**
     * Validates that every operand of a solver-native constraint is atomic.
     *
     * @throws MalformedReconstructionException if an operand is compound
     */
    static List<Expression> requireAtoms(String kind, List<Expression> operands) {
        for (Expression operand : operands) {
            if (!operand.isAtomic()) {
                throw new MalformedReconstructionException(
                        kind + " accepts atoms only, got: " + operand);
            }
        }
        return List.copyOf(operands);
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Declaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a rule transform.
 *
 * @param replacement terms that take the place of the matched term; more or fewer
 *                    than one is only valid in a variadic context or at the root
 * @param newTopLevel constraints appended to the model's root
 * @param newSymbols  auxiliary variables added to the symbol table
 */
public record Reduction(List<Expression> replacement,
                        List<Expression> newTopLevel,
                        List<Declaration> newSymbols) {

    public Reduction {
        replacement = List.copyOf(replacement);
        newTopLevel = List.copyOf(newTopLevel);
        newSymbols = List.copyOf(newSymbols);
    }

    /**
     * Plain substitution of one term, no side effects.
     */
    public static Reduction pure(Expression replacement) {
        return new Reduction(List.of(replacement), List.of(), List.of());
    }

    /**
     * Replacement by an ordered list of terms, spliced into the enclosing list.
     */
    public static Reduction splice(List<Expression> replacement) {
        return new Reduction(replacement, List.of(), List.of());
    }

    public Reduction withTopLevel(Expression constraint) {
        List<Expression> extended = new ArrayList<>(newTopLevel);
        extended.add(constraint);
        return new Reduction(replacement, extended, newSymbols);
    }

    public Reduction withSymbol(Declaration declaration) {
        List<Declaration> extended = new ArrayList<>(newSymbols);
        extended.add(declaration);
        return new Reduction(replacement, newTopLevel, extended);
    }

    public boolean hasSideEffects() {
        return !newTopLevel.isEmpty() || !newSymbols.isEmpty();
    }
}

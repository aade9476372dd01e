/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.model;

import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.Root;

import java.util.List;
import java.util.Objects;

/**
 * The artifact being rewritten: a symbol table plus the root constraint list.
 *
 * <p>Mutable; the rewriter replaces the root and symbol table only after a step
 * has fully succeeded, so observers never see a half-applied rewrite.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SymbolTable symbols = new SymbolTable()
 *     .declare(Declaration.find("x", BoolDomain.INSTANCE));
 * Model model = new Model(symbols, List.of(new Not(Reference.of("x"))));
 * }</pre>
 */
public final class Model {

    private SymbolTable symbols;
    private Root root;

    public Model(SymbolTable symbols, Root root) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
        this.root = Objects.requireNonNull(root, "root");
    }

    public Model(SymbolTable symbols, List<Expression> constraints) {
        this(symbols, new Root(constraints));
    }

    public SymbolTable symbols() {
        return symbols;
    }

    public Root root() {
        return root;
    }

    public List<Expression> constraints() {
        return root.constraints();
    }

    /**
     * Replaces root and symbol table together.
     */
    public void update(Root newRoot, SymbolTable newSymbols) {
        this.root = Objects.requireNonNull(newRoot, "newRoot");
        this.symbols = Objects.requireNonNull(newSymbols, "newSymbols");
    }

    /**
     * Independent snapshot; later updates to either model do not affect the other.
     */
    public Model copy() {
        return new Model(symbols.copy(), root);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Model)) return false;
        Model other = (Model) o;
        return symbols.equals(other.symbols) && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, root);
    }

    /**
     * Pretty-printed form: declarations, a blank line, {@code such that}, a blank
     * line, then the constraints one per line.
     */
    @Override
    public String toString() {
        String declarations = symbols.toString();
        String constraints = "such that\n\n" + root;
        return declarations.isEmpty() ? constraints : declarations + "\n\n" + constraints;
    }
}

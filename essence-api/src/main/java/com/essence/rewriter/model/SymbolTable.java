/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.model;

import com.essence.rewriter.api.exceptions.UnresolvedIdentifierException;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.Name;
import com.essence.rewriter.ast.Reference;
import com.essence.rewriter.ast.WatchedLiteral;
import com.essence.rewriter.term.Terms;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Insertion-ordered table of declared decision variables.
 */
public final class SymbolTable implements Symbols {

    private final Map<Name, Declaration> declarations = new LinkedHashMap<>();
    private int nextMachineName;

    public SymbolTable() {
    }

    private SymbolTable(SymbolTable other) {
        this.declarations.putAll(other.declarations);
        this.nextMachineName = other.nextMachineName;
    }

    /**
     * Declares a variable.
     *
     * @throws IllegalArgumentException if the name is already declared
     */
    public SymbolTable declare(Declaration declaration) {
        if (declarations.putIfAbsent(declaration.name(), declaration) != null) {
            throw new IllegalArgumentException("Duplicate declaration: " + declaration.name());
        }
        if (declaration.name().isMachine()) {
            nextMachineName = Math.max(nextMachineName, machineNumber(declaration.name()) + 1);
        }
        return this;
    }

    @Override
    public Declaration lookup(Name name) {
        Declaration declaration = declarations.get(name);
        if (declaration == null) {
            throw new UnresolvedIdentifierException(name);
        }
        return declaration;
    }

    @Override
    public Optional<Declaration> find(Name name) {
        return Optional.ofNullable(declarations.get(name));
    }

    @Override
    public Collection<Declaration> declarations() {
        return Collections.unmodifiableCollection(declarations.values());
    }

    @Override
    public List<Name> freshNames(int count) {
        List<Name> names = new ArrayList<>(count);
        int candidate = nextMachineName;
        while (names.size() < count) {
            Name name = Name.machine(candidate++);
            if (!declarations.containsKey(name)) {
                names.add(name);
            }
        }
        return names;
    }

    public int size() {
        return declarations.size();
    }

    /**
     * Checks that every reference in {@code expression} is declared.
     *
     * @throws UnresolvedIdentifierException for the first undeclared name, in pre-order
     */
    public void validateReferences(Expression expression) {
        for (Expression node : Terms.universe(expression)) {
            if (node instanceof Reference reference) {
                lookup(reference.name());
            } else if (node instanceof WatchedLiteral literal) {
                lookup(literal.name());
            }
        }
    }

    public SymbolTable copy() {
        return new SymbolTable(this);
    }

    private static int machineNumber(Name name) {
        try {
            return Integer.parseInt(name.value().substring(2));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolTable)) return false;
        return new ArrayList<>(declarations.values()).equals(new ArrayList<>(((SymbolTable) o).declarations.values()));
    }

    @Override
    public int hashCode() {
        return new ArrayList<>(declarations.values()).hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Declaration declaration : declarations.values()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(declaration);
        }
        return sb.toString();
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.model;

import com.essence.rewriter.api.exceptions.UnresolvedIdentifierException;
import com.essence.rewriter.ast.Domain;
import com.essence.rewriter.ast.Name;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a symbol table, handed to rules.
 */
public interface Symbols {

    /**
     * @throws UnresolvedIdentifierException if {@code name} is not declared
     */
    Declaration lookup(Name name);

    Optional<Declaration> find(Name name);

    default Domain domainOf(Name name) {
        return lookup(name).domain();
    }

    default boolean contains(Name name) {
        return find(name).isPresent();
    }

    Collection<Declaration> declarations();

    /**
     * The next {@code count} machine names not yet declared, without reserving them.
     * A rule introducing auxiliary variables declares them through its reduction.
     */
    List<Name> freshNames(int count);
}

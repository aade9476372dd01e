/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.model;

import com.essence.rewriter.ast.Domain;
import com.essence.rewriter.ast.Name;

import java.util.Objects;

/**
 * A decision variable declaration, printed {@code find x: int(1..3)}.
 */
public record Declaration(Name name, Domain domain) {

    public Declaration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(domain, "domain");
    }

    public static Declaration find(String name, Domain domain) {
        return new Declaration(Name.of(name), domain);
    }

    @Override
    public String toString() {
        return "find " + name + ": " + domain;
    }
}

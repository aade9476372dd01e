/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import java.util.Objects;

/**
 * Use of a declared variable.
 */
public record Reference(Name name) implements Atom {

    public Reference {
        Objects.requireNonNull(name, "name");
    }

    public static Reference of(String name) {
        return new Reference(Name.of(name));
    }

    @Override
    public String toString() {
        return name.toString();
    }
}

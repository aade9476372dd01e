/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import java.util.Objects;

/**
 * Identifier bound in a symbol table. Machine names ({@code __0}, {@code __1}, ...)
 * are generated for auxiliary variables and never clash with user names.
 */
public record Name(String value) implements Comparable<Name> {

    private static final String MACHINE_PREFIX = "__";

    public Name {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Name cannot be blank");
        }
    }

    public static Name of(String value) {
        return new Name(value);
    }

    public static Name machine(int number) {
        return new Name(MACHINE_PREFIX + number);
    }

    public boolean isMachine() {
        return value.startsWith(MACHINE_PREFIX);
    }

    @Override
    public int compareTo(Name other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

/**
 * Integer range with optional bounds; {@code null} means unbounded on that side.
 */
public record Range(Integer lower, Integer upper) {

    public Range {
        if (lower != null && upper != null && lower > upper) {
            throw new IllegalArgumentException("Empty range: " + lower + ".." + upper);
        }
    }

    public static Range bounded(int lower, int upper) {
        return new Range(lower, upper);
    }

    public static Range single(int value) {
        return new Range(value, value);
    }

    public static Range from(int lower) {
        return new Range(lower, null);
    }

    public boolean isBounded() {
        return lower != null && upper != null;
    }

    @Override
    public String toString() {
        if (lower != null && lower.equals(upper)) {
            return lower.toString();
        }
        return (lower == null ? "" : lower.toString()) + ".." + (upper == null ? "" : upper.toString());
    }
}

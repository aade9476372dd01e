/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Union of integer ranges, printed {@code int(1..3,5)}.
 */
public record IntDomain(List<Range> ranges) implements Domain {

    public IntDomain {
        ranges = List.copyOf(ranges);
    }

    public static IntDomain of(Range... ranges) {
        return new IntDomain(List.of(ranges));
    }

    public static IntDomain bounded(int lower, int upper) {
        return of(Range.bounded(lower, upper));
    }

    @Override
    public boolean isBounded() {
        return !ranges.isEmpty() && ranges.stream().allMatch(Range::isBounded);
    }

    public OptionalInt min() {
        if (!isBounded()) {
            return OptionalInt.empty();
        }
        return ranges.stream().mapToInt(Range::lower).min();
    }

    public OptionalInt max() {
        if (!isBounded()) {
            return OptionalInt.empty();
        }
        return ranges.stream().mapToInt(Range::upper).max();
    }

    @Override
    public String toString() {
        return ranges.stream().map(Range::toString).collect(Collectors.joining(",", "int(", ")"));
    }
}

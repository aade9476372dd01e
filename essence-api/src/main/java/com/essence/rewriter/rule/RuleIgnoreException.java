/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

/**
 * Thrown by a condition or transform to withdraw the matched term, and its
 * descendants down to {@code depth} levels below it, from the current step.
 * With a depth of {@code 0} only the matched term is skipped.
 *
 * <p>No rule is attempted on the skipped terms until the next step. Like
 * {@link RuleNotApplicableException} this is control flow: the attempt and any
 * side effects it was building are discarded.
 */
public class RuleIgnoreException extends RuntimeException {

    private final int depth;

    public RuleIgnoreException(int depth, String reason) {
        super(reason, null, false, false);
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        this.depth = depth;
    }

    /**
     * Levels below the matched term that are skipped as well.
     */
    public int getDepth() {
        return depth;
    }
}

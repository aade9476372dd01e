/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

/**
 * Thrown by a transform that discovers, part way through, that it cannot rewrite
 * the term. The engine discards the attempt and moves on to the next candidate.
 *
 * <p>Control flow, not an error: no stack trace is captured.
 */
public class RuleNotApplicableException extends RuntimeException {

    public RuleNotApplicableException(String reason) {
        super(reason, null, false, false);
    }
}

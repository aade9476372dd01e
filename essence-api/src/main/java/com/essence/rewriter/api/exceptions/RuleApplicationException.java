/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.exceptions;

/**
 * Wraps an unexpected exception thrown by a rule's applicability test or transform.
 */
public class RuleApplicationException extends RewriteException {

    private final String ruleName;
    private final String term;
    private final int step;

    public RuleApplicationException(String ruleName, String term, int step, Throwable cause) {
        super(String.format("Rule '%s' failed on '%s' at step %d: %s",
                ruleName, term, step, cause.getMessage()), cause);
        this.ruleName = ruleName;
        this.term = term;
        this.step = step;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getTerm() {
        return term;
    }

    public int getStep() {
        return step;
    }
}

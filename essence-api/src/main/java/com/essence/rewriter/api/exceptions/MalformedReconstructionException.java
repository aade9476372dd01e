/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.exceptions;

/**
 * Thrown when a node cannot be rebuilt with the children it was given, or a
 * replacement cannot be substituted at the position it was matched.
 *
 * <p>Always a rule-authoring bug, so the current run is aborted. The engine
 * re-throws it through {@link #withContext(String, String, int)} so the message
 * names the offending rule, term and step.
 */
public class MalformedReconstructionException extends RewriteException {

    private final String ruleName;
    private final String term;
    private final int step;

    public MalformedReconstructionException(String message) {
        this(message, null, null, -1, null);
    }

    private MalformedReconstructionException(String message, String ruleName, String term, int step,
                                             Throwable cause) {
        super(message, cause);
        this.ruleName = ruleName;
        this.term = term;
        this.step = step;
    }

    /**
     * Returns a copy of this exception annotated with the rule application that caused it.
     */
    public MalformedReconstructionException withContext(String ruleName, String term, int step) {
        String message = String.format("Rule '%s' produced a malformed replacement for '%s' at step %d: %s",
                ruleName, term, step, getMessage());
        return new MalformedReconstructionException(message, ruleName, term, step, this);
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

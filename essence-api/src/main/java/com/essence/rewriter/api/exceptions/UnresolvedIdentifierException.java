/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.exceptions;

import com.essence.rewriter.ast.Name;

/**
 * Thrown when an expression references a name that the symbol table does not declare.
 * Detected lazily, at the point a rule or renderer needs the declaration.
 *
 * <p>Raised inside a rule, it reaches the caller through
 * {@link #withContext(String, String, int)}, naming the rule, term and step.
 */
public class UnresolvedIdentifierException extends RewriteException {

    private final Name name;
    private final String ruleName;
    private final String term;
    private final int step;

    public UnresolvedIdentifierException(Name name) {
        this("Unresolved identifier: " + name, name, null, null, -1, null);
    }

    private UnresolvedIdentifierException(String message, Name name, String ruleName, String term, int step,
                                          Throwable cause) {
        super(message, cause);
        this.name = name;
        this.ruleName = ruleName;
        this.term = term;
        this.step = step;
    }

    /**
     * Returns a copy of this exception annotated with the rule application that raised it.
     */
    public UnresolvedIdentifierException withContext(String ruleName, String term, int step) {
        String message = String.format("Rule '%s' met an unresolved identifier '%s' in '%s' at step %d",
                ruleName, name, term, step);
        return new UnresolvedIdentifierException(message, name, ruleName, term, step, this);
    }

    public Name getName() {
        return name;
    }

    /**
     * @return the rule that met the name, or {@code null} outside a rule application
     */
    public String getRuleName() {
        return ruleName;
    }

    public String getTerm() {
        return term;
    }

    /**
     * @return the step index, or {@code -1} outside a rule application
     */
    public int getStep() {
        return step;
    }
}

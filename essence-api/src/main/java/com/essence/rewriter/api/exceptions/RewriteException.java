/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.exceptions;

/**
 * Base exception for every failure raised while registering rules or rewriting a model.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * through rule code, while still carrying enough context (rule, term, step)
 * to reproduce the failing trace.
 */
public class RewriteException extends RuntimeException {

    public RewriteException(String message) {
        super(message);
    }

    public RewriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.exceptions;

/**
 * Thrown while building the rule registry when two rules (or two rule sets)
 * share a name, or a rule names a rule set nobody declared.
 *
 * <p>Raised before any rewriting starts; the registry is not installed.
 */
public class RegistrationConflictException extends RewriteException {

    public RegistrationConflictException(String message) {
        super(message);
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine;

import com.essence.rewriter.api.exceptions.MalformedReconstructionException;
import com.essence.rewriter.api.exceptions.RewriteException;
import com.essence.rewriter.api.exceptions.RuleApplicationException;
import com.essence.rewriter.api.exceptions.UnresolvedIdentifierException;

/**
 * Attaches the rule, term and step to a failure raised while a rule ran.
 */
final class RuleFailures {

    private RuleFailures() {
    }

    static RewriteException withContext(RuntimeException failure, String ruleName, String term, int step) {
        if (failure instanceof MalformedReconstructionException malformed) {
            return malformed.withContext(ruleName, term, step);
        }
        if (failure instanceof UnresolvedIdentifierException unresolved) {
            return unresolved.withContext(ruleName, term, step);
        }
        return new RuleApplicationException(ruleName, term, step, failure);
    }
}

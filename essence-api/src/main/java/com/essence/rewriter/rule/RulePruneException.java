/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

/**
 * Withdraws the matched term and its whole subtree from the current step.
 */
public class RulePruneException extends RuleIgnoreException {

    public RulePruneException(String reason) {
        super(Integer.MAX_VALUE, reason);
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

import java.util.Objects;

/**
 * A rule's priority within one rule set. Printed {@code ("Base", 2000)} in traces.
 */
public record RuleSetMembership(String ruleSet, int priority) {

    public RuleSetMembership {
        Objects.requireNonNull(ruleSet, "ruleSet");
    }

    @Override
    public String toString() {
        return "(\"" + ruleSet + "\", " + priority + ")";
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

/**
 * A rule as seen through one rule set: the rule plus its priority there.
 */
public record RuleData(Rule rule, String ruleSet, int priority) {

    public String name() {
        return rule.name();
    }
}

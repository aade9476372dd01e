/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

import java.util.List;
import java.util.Objects;

/**
 * Named group of rules. Activating a rule set also activates its dependencies,
 * which take precedence over it when priorities tie.
 *
 * @param name unique rule set name
 * @param dependencies names of rule sets that must be active alongside this one
 */
public record RuleSet(String name, List<String> dependencies) {

    public RuleSet {
        Objects.requireNonNull(name, "name");
        dependencies = List.copyOf(dependencies);
    }

    public static RuleSet of(String name, String... dependencies) {
        return new RuleSet(name, List.of(dependencies));
    }
}

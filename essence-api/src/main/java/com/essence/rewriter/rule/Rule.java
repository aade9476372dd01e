/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rule;

import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Symbols;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable rewrite rule: a name, an applicability test, a transform and the
 * rule sets it belongs to with a priority in each.
 *
 * <p>A rule with {@code requiresVariadicContext} is only tried on terms that are
 * the root or sit directly in a variadic (conjunctive) list. Such rules may
 * return several replacement terms, and may assume their match is a constraint
 * in its own right.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Rule rule = Rule.builder("remove_unit_conjunction")
 *     .condition((term, symbols) -> term instanceof And and && and.operands().size() == 1)
 *     .transform((term, symbols) -> Reduction.pure(((And) term).operands().get(0)))
 *     .ruleSet("Base", 2000)
 *     .build();
 * }</pre>
 */
public record Rule(String name,
                   RuleCondition condition,
                   RuleTransform transform,
                   List<RuleSetMembership> memberships,
                   boolean requiresVariadicContext) {

    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(transform, "transform");
        memberships = List.copyOf(memberships);
        if (name.isBlank()) {
            throw new IllegalArgumentException("Rule name cannot be blank");
        }
        if (memberships.isEmpty()) {
            throw new IllegalArgumentException("Rule '" + name + "' belongs to no rule set");
        }
        Set<String> seen = new HashSet<>();
        for (RuleSetMembership membership : memberships) {
            if (!seen.add(membership.ruleSet())) {
                throw new IllegalArgumentException(
                        "Rule '" + name + "' lists rule set '" + membership.ruleSet() + "' twice");
            }
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public boolean isApplicable(Expression term, Symbols symbols) {
        return condition.test(term, symbols);
    }

    public Reduction apply(Expression term, Symbols symbols) {
        return transform.apply(term, symbols);
    }

    /**
     * Priority of this rule in {@code ruleSet}, if it belongs to it.
     */
    public OptionalInt priorityIn(String ruleSet) {
        for (RuleSetMembership membership : memberships) {
            if (membership.ruleSet().equals(ruleSet)) {
                return OptionalInt.of(membership.priority());
            }
        }
        return OptionalInt.empty();
    }

    @Override
    public String toString() {
        return name + " " + memberships;
    }

    public static final class Builder {
        private final String name;
        private RuleCondition condition;
        private RuleTransform transform;
        private final List<RuleSetMembership> memberships = new ArrayList<>();
        private boolean requiresVariadicContext;

        private Builder(String name) {
            this.name = name;
        }

        public Builder condition(RuleCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder transform(RuleTransform transform) {
            this.transform = transform;
            return this;
        }

        public Builder ruleSet(String ruleSet, int priority) {
            this.memberships.add(new RuleSetMembership(ruleSet, priority));
            return this;
        }

        public Builder requiresVariadicContext() {
            this.requiresVariadicContext = true;
            return this;
        }

        public Rule build() {
            return new Rule(name, condition, transform, memberships, requiresVariadicContext);
        }
    }
}

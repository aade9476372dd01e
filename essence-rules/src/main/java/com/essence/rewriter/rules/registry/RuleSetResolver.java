/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rules.registry;

import com.essence.rewriter.api.exceptions.RegistrationConflictException;
import com.essence.rewriter.rule.RuleSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Expands configured rule set names into the ordered list of active rule sets.
 *
 * <p>Each configured name appears after its transitive dependencies (depth-first,
 * declaration order of dependencies); a rule set reached twice keeps its first
 * position. The resulting order is the precedence used to break priority ties.
 *
 * <pre>
 * Base
 * Minion -> Base
 *
 * resolve([Minion])       = [Base, Minion]
 * resolve([Minion, Base]) = [Base, Minion]
 * </pre>
 */
public final class RuleSetResolver {

    private final Map<String, RuleSet> ruleSets;

    public RuleSetResolver(Map<String, RuleSet> ruleSets) {
        this.ruleSets = Map.copyOf(ruleSets);
    }

    /**
     * @throws IllegalArgumentException      if a configured name is not a known rule set
     * @throws RegistrationConflictException if the dependencies form a cycle
     */
    public List<String> resolve(List<String> configured) {
        Set<String> resolved = new LinkedHashSet<>();
        for (String name : configured) {
            if (!ruleSets.containsKey(name)) {
                throw new IllegalArgumentException("Unknown rule set: " + name);
            }
            visit(name, resolved, new ArrayList<>(), new HashSet<>());
        }
        return List.copyOf(resolved);
    }

    private void visit(String name, Set<String> resolved, List<String> chain, Set<String> inProgress) {
        if (resolved.contains(name)) {
            return;
        }
        if (!inProgress.add(name)) {
            chain.add(name);
            throw new RegistrationConflictException("Rule set dependency cycle: " + String.join(" -> ", chain));
        }
        chain.add(name);
        RuleSet ruleSet = ruleSets.get(name);
        if (ruleSet == null) {
            throw new IllegalArgumentException("Unknown rule set: " + name);
        }
        for (String dependency : ruleSet.dependencies()) {
            visit(dependency, resolved, chain, inProgress);
        }
        chain.remove(chain.size() - 1);
        inProgress.remove(name);
        resolved.add(name);
    }
}

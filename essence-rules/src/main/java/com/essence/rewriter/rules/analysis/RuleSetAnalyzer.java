/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rules.analysis;

import com.essence.rewriter.rule.RuleData;
import com.essence.rewriter.rules.registry.RuleRegistry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds rules whose relative order inside a rule set is decided by the tie-break
 * rather than by priority.
 *
 * <p>Two rules of one rule set sharing a priority are not wrong, but when both apply
 * to the same subterm the winner is whichever was registered first. Reporting such
 * groups lets rule authors make the intended order explicit.
 *
 * <h2>Usage</h2>
 * <pre>
 * RuleSetAnalyzer analyzer = new RuleSetAnalyzer();
 * AmbiguityReport report = analyzer.analyze(registry, List.of("Minion"));
 *
 * for (TieGroup group : report.ties()) {
 *     System.out.println(group.describe());
 * }
 * </pre>
 */
public class RuleSetAnalyzer {

    /**
     * Analyzes the active rule sets resolved from {@code configured}.
     *
     * @param registry   registry holding the rules
     * @param configured rule set names as configured; dependencies are included
     * @return groups of equal-priority rules, in precedence then priority order
     */
    public AmbiguityReport analyze(RuleRegistry registry, List<String> configured) {
        List<String> active = registry.resolve(configured);
        List<TieGroup> ties = new ArrayList<>();

        for (String ruleSet : active) {
            Map<Integer, List<String>> byPriority = new LinkedHashMap<>();
            for (RuleData data : registry.rulesFor(ruleSet)) {
                byPriority.computeIfAbsent(data.priority(), p -> new ArrayList<>()).add(data.name());
            }
            byPriority.forEach((priority, names) -> {
                if (names.size() > 1) {
                    ties.add(new TieGroup(ruleSet, priority, names));
                }
            });
        }

        return new AmbiguityReport(active, ties);
    }

    /**
     * Report of priority ties across the active rule sets.
     *
     * @param activeRuleSets resolved rule sets analyzed, in precedence order
     * @param ties           groups of rules sharing a priority within one rule set
     */
    public record AmbiguityReport(List<String> activeRuleSets, List<TieGroup> ties) {

        public AmbiguityReport {
            activeRuleSets = List.copyOf(activeRuleSets);
            ties = List.copyOf(ties);
        }

        public boolean hasTies() {
            return !ties.isEmpty();
        }

        public int tieCount() {
            return ties.size();
        }
    }

    /**
     * Rules sharing one priority in one rule set, in registration order (the order
     * the tie-break applies them in).
     */
    public record TieGroup(String ruleSet, int priority, List<String> ruleNames) {

        public TieGroup {
            ruleNames = List.copyOf(ruleNames);
        }

        public String describe() {
            return String.format("Rule set '%s', priority %d: %s (resolved by registration order)",
                    ruleSet, priority, String.join(", ", ruleNames));
        }
    }
}

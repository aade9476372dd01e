/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine;

import com.essence.rewriter.rule.Rule;
import com.essence.rewriter.rule.RuleData;
import com.essence.rewriter.rule.RuleSetMembership;
import com.essence.rewriter.rules.registry.RuleRegistry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The rules of one run: every rule of the resolved rule sets, each listed once and
 * ranked by its best membership.
 *
 * <p>A rule in several active rule sets takes its highest priority among them; on
 * equal priorities the earlier rule set wins. Its trace shows every active
 * membership, in rule set precedence order.
 */
final class ActiveRules {

    /**
     * One rule with its ranking keys.
     *
     * @param rule              the rule
     * @param priority          best priority among the active memberships
     * @param precedence        position of that membership's rule set in the active list
     * @param registrationIndex position of the rule in the registry
     * @param memberships       every active membership, in precedence order
     */
    record ActiveRule(Rule rule, int priority, int precedence, int registrationIndex,
                      List<RuleSetMembership> memberships) {

        String name() {
            return rule.name();
        }
    }

    static final Comparator<ActiveRule> RANK = Comparator.comparingInt(ActiveRule::priority).reversed()
            .thenComparingInt(ActiveRule::precedence)
            .thenComparingInt(ActiveRule::registrationIndex);

    private final List<String> ruleSets;
    private final List<ActiveRule> rules;

    private ActiveRules(List<String> ruleSets, List<ActiveRule> rules) {
        this.ruleSets = List.copyOf(ruleSets);
        this.rules = List.copyOf(rules);
    }

    /**
     * Resolves {@code configured} against {@code registry} and collects the rules.
     *
     * @throws IllegalArgumentException if a configured rule set is unknown
     */
    static ActiveRules resolve(RuleRegistry registry, List<String> configured) {
        List<String> active = registry.resolve(configured);

        Object2IntMap<String> precedence = new Object2IntOpenHashMap<>(active.size());
        for (int i = 0; i < active.size(); i++) {
            precedence.put(active.get(i), i);
        }

        Map<String, List<RuleData>> byRule = new LinkedHashMap<>();
        for (String ruleSet : active) {
            for (RuleData data : registry.rulesFor(ruleSet)) {
                byRule.computeIfAbsent(data.name(), n -> new ArrayList<>()).add(data);
            }
        }

        List<ActiveRule> rules = new ArrayList<>(byRule.size());
        for (List<RuleData> entries : byRule.values()) {
            // entries are already in precedence order
            RuleData best = entries.get(0);
            List<RuleSetMembership> memberships = new ArrayList<>(entries.size());
            for (RuleData data : entries) {
                memberships.add(new RuleSetMembership(data.ruleSet(), data.priority()));
                if (data.priority() > best.priority()) {
                    best = data;
                }
            }
            rules.add(new ActiveRule(best.rule(), best.priority(), precedence.getInt(best.ruleSet()),
                    registry.registrationIndex(best.name()), memberships));
        }
        rules.sort(RANK);
        return new ActiveRules(active, rules);
    }

    /**
     * Resolved rule set names, dependencies first.
     */
    List<String> ruleSets() {
        return ruleSets;
    }

    /**
     * Rules in rank order.
     */
    List<ActiveRule> rules() {
        return rules;
    }

    boolean isEmpty() {
        return rules.isEmpty();
    }
}

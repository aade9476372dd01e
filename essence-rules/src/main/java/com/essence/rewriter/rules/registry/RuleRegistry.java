/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rules.registry;

import com.essence.rewriter.api.exceptions.RegistrationConflictException;
import com.essence.rewriter.rule.Rule;
import com.essence.rewriter.rule.RuleData;
import com.essence.rewriter.rule.RuleSet;
import com.essence.rewriter.rule.RuleSetMembership;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Process-wide catalogue of rules and rule sets.
 *
 * <p>Built once from a list of {@link RuleModule}s and immutable afterwards, so it
 * can be shared by concurrent rewrite runs. Registration is all-or-nothing: on any
 * conflict nothing is installed.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RuleRegistry registry = RuleRegistry.getInstance();      // ServiceLoader discovery
 * List<RuleData> minion = registry.rulesFor("Minion");     // priority descending
 *
 * // Explicit modules, e.g. in tests
 * RuleRegistry custom = RuleRegistry.of(List.of(new BaseRules()));
 * }</pre>
 */
public final class RuleRegistry {

    private static final Logger logger = Logger.getLogger(RuleRegistry.class.getName());

    private static volatile RuleRegistry instance;

    private final Map<String, RuleSet> ruleSets;
    private final Map<String, Rule> rules;
    private final Object2IntMap<String> registrationIndex;
    private final Map<String, List<RuleData>> rulesBySet;

    private RuleRegistry(Map<String, RuleSet> ruleSets, Map<String, Rule> rules) {
        this.ruleSets = Collections.unmodifiableMap(ruleSets);
        this.rules = Collections.unmodifiableMap(rules);

        this.registrationIndex = new Object2IntOpenHashMap<>(rules.size());
        this.registrationIndex.defaultReturnValue(-1);
        int index = 0;
        for (String name : rules.keySet()) {
            registrationIndex.put(name, index++);
        }

        Map<String, List<RuleData>> bySet = new LinkedHashMap<>();
        for (String setName : ruleSets.keySet()) {
            bySet.put(setName, new ArrayList<>());
        }
        for (Rule rule : rules.values()) {
            for (RuleSetMembership membership : rule.memberships()) {
                bySet.get(membership.ruleSet()).add(new RuleData(rule, membership.ruleSet(), membership.priority()));
            }
        }
        Comparator<RuleData> order = Comparator.comparingInt(RuleData::priority).reversed()
                .thenComparingInt(data -> registrationIndex.getInt(data.name()));
        bySet.replaceAll((setName, list) -> list.stream().sorted(order).toList());
        this.rulesBySet = Collections.unmodifiableMap(bySet);
    }

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    /**
     * Builds a registry from the given modules without installing it globally.
     *
     * @throws RegistrationConflictException on duplicate rule or rule set names, or
     *                                       references to undeclared rule sets
     */
    public static RuleRegistry of(List<? extends RuleModule> modules) {
        Map<String, RuleSet> ruleSets = new LinkedHashMap<>();
        for (RuleModule module : modules) {
            for (RuleSet ruleSet : module.ruleSets()) {
                if (ruleSets.putIfAbsent(ruleSet.name(), ruleSet) != null) {
                    throw new RegistrationConflictException(String.format(
                            "Rule set '%s' declared twice (second declaration in module '%s')",
                            ruleSet.name(), module.name()));
                }
            }
        }

        for (RuleSet ruleSet : ruleSets.values()) {
            for (String dependency : ruleSet.dependencies()) {
                if (!ruleSets.containsKey(dependency)) {
                    throw new RegistrationConflictException(String.format(
                            "Rule set '%s' depends on unknown rule set '%s'", ruleSet.name(), dependency));
                }
            }
        }

        Map<String, Rule> rules = new LinkedHashMap<>();
        for (RuleModule module : modules) {
            for (Rule rule : module.rules()) {
                if (rules.putIfAbsent(rule.name(), rule) != null) {
                    throw new RegistrationConflictException(String.format(
                            "Rule '%s' registered twice (second registration in module '%s')",
                            rule.name(), module.name()));
                }
                for (RuleSetMembership membership : rule.memberships()) {
                    if (!ruleSets.containsKey(membership.ruleSet())) {
                        throw new RegistrationConflictException(String.format(
                                "Rule '%s' names unknown rule set '%s'", rule.name(), membership.ruleSet()));
                    }
                }
            }
        }

        return new RuleRegistry(ruleSets, rules);
    }

    /**
     * Discovers every {@link RuleModule} on the classpath and installs the result
     * as the global registry. Discovered modules are ordered by name.
     */
    public static RuleRegistry initialize() {
        ServiceLoader<RuleModule> loader = ServiceLoader.load(RuleModule.class);
        List<RuleModule> modules = StreamSupport.stream(loader.spliterator(), false)
                .sorted(Comparator.comparing(RuleModule::name))
                .collect(Collectors.toList());
        return initialize(modules);
    }

    /**
     * Builds a registry from {@code modules}, in the given order, and installs it
     * as the global registry.
     */
    public static synchronized RuleRegistry initialize(List<? extends RuleModule> modules) {
        RuleRegistry registry = of(modules);
        instance = registry;
        logger.info(String.format("Rule registry initialised: %d rules in %d rule sets from modules %s",
                registry.rules.size(), registry.ruleSets.size(),
                modules.stream().map(RuleModule::name).collect(Collectors.toList())));
        return registry;
    }

    /**
     * The installed registry, discovering modules via {@link ServiceLoader} on first use.
     */
    public static RuleRegistry getInstance() {
        RuleRegistry current = instance;
        if (current == null) {
            synchronized (RuleRegistry.class) {
                current = instance;
                if (current == null) {
                    current = initialize();
                }
            }
        }
        return current;
    }

    /**
     * Drops the installed registry; the next {@link #getInstance()} rediscovers modules.
     */
    public static synchronized void reset() {
        instance = null;
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    /**
     * Rules of {@code ruleSet}, by priority descending then registration order.
     *
     * @throws IllegalArgumentException if the rule set is unknown
     */
    public List<RuleData> rulesFor(String ruleSet) {
        List<RuleData> data = rulesBySet.get(ruleSet);
        if (data == null) {
            throw new IllegalArgumentException("Unknown rule set: " + ruleSet);
        }
        return data;
    }

    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public Optional<RuleSet> ruleSet(String name) {
        return Optional.ofNullable(ruleSets.get(name));
    }

    /**
     * Every declared rule set, in declaration order.
     */
    public Collection<RuleSet> ruleSets() {
        return ruleSets.values();
    }

    /**
     * Every registered rule, in registration order.
     */
    public Collection<Rule> rules() {
        return rules.values();
    }

    /**
     * Position of the rule in registration order, or {@code -1} if unknown.
     */
    public int registrationIndex(String ruleName) {
        return registrationIndex.getInt(ruleName);
    }

    /**
     * Resolves configured rule set names to the active list, dependencies first.
     */
    public List<String> resolve(List<String> configured) {
        return new RuleSetResolver(ruleSets).resolve(configured);
    }

    public int size() {
        return rules.size();
    }
}

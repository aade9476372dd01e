/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rules.registry;

import com.essence.rewriter.rule.Rule;
import com.essence.rewriter.rule.RuleSet;

import java.util.List;

/**
 * Service provider contributing rule sets and rules to the {@link RuleRegistry}.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Register in
 * {@code META-INF/services/com.essence.rewriter.rules.registry.RuleModule}.
 *
 * <p>A module may add rules to rule sets declared by another module; the registry
 * checks membership only after every module's rule sets are known.
 */
public interface RuleModule {

    /**
     * Module name used in log messages and to order discovered modules.
     */
    String name();

    /**
     * Rule sets this module declares. May be empty.
     */
    List<RuleSet> ruleSets();

    /**
     * Rules this module registers, in registration order.
     */
    List<Rule> rules();
}

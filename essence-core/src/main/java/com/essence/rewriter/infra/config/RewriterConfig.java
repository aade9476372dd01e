/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.infra.config;

import com.essence.rewriter.api.model.CancellationToken;
import com.essence.rewriter.api.model.RewriteOptions;
import com.essence.rewriter.api.model.SelectionStrategy;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Configuration of a rewrite run.
 *
 * <p>Values are resolved in increasing order of precedence:
 * <ol>
 *   <li>Built-in defaults</li>
 *   <li>Properties file ({@code rewriter.properties} by default)</li>
 *   <li>Environment variables {@code REWRITER_<PROPERTY_NAME>}</li>
 * </ol>
 *
 * <p>Example properties file:
 * <pre>
 * rewriter.rule.sets=Minion
 * rewriter.max.iterations=10000
 * rewriter.strategy=PRIORITY
 * rewriter.extra.rule.checks=false
 * rewriter.trace.enabled=true
 * </pre>
 *
 * <p>Example environment variables:
 * <pre>
 * REWRITER_RULE_SETS=Base,Minion
 * REWRITER_MAX_ITERATIONS=500
 * REWRITER_EXTRA_RULE_CHECKS=true
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * RewriterConfig config = RewriterConfig.loadDefault();
 * RewriteResult result = rewriter.rewrite(model, config.ruleSets(), config.toOptions());
 *
 * // Programmatic config
 * RewriterConfig config = RewriterConfig.builder()
 *     .ruleSets(List.of("Minion"))
 *     .maxIterations(500)
 *     .extraRuleChecks(true)
 *     .build();
 * }</pre>
 */
public final class RewriterConfig {

    private static final Logger logger = Logger.getLogger(RewriterConfig.class.getName());

    // ========================================================================
    // PROPERTY KEYS
    // ========================================================================

    public static final String DEFAULT_PROPERTIES_FILE = "rewriter.properties";

    static final String PROP_RULE_SETS = "rewriter.rule.sets";
    static final String PROP_MAX_ITERATIONS = "rewriter.max.iterations";
    static final String PROP_STRATEGY = "rewriter.strategy";
    static final String PROP_EXTRA_RULE_CHECKS = "rewriter.extra.rule.checks";
    static final String PROP_TRACE_ENABLED = "rewriter.trace.enabled";

    static final String ENV_RULE_SETS = "REWRITER_RULE_SETS";
    static final String ENV_MAX_ITERATIONS = "REWRITER_MAX_ITERATIONS";
    static final String ENV_STRATEGY = "REWRITER_STRATEGY";
    static final String ENV_EXTRA_RULE_CHECKS = "REWRITER_EXTRA_RULE_CHECKS";
    static final String ENV_TRACE_ENABLED = "REWRITER_TRACE_ENABLED";

    // ========================================================================
    // DEFAULTS
    // ========================================================================

    private static final List<String> DEFAULT_RULE_SETS = List.of("Minion");

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final List<String> ruleSets;
    private final int maxIterations;
    private final SelectionStrategy strategy;
    private final boolean extraRuleChecks;
    private final boolean traceEnabled;

    private RewriterConfig(Builder builder) {
        this.ruleSets = List.copyOf(builder.ruleSets);
        this.maxIterations = builder.maxIterations;
        this.strategy = builder.strategy;
        this.extraRuleChecks = builder.extraRuleChecks;
        this.traceEnabled = builder.traceEnabled;
        validate();
    }

    private void validate() {
        if (ruleSets.isEmpty()) {
            throw new IllegalArgumentException("At least one rule set must be configured");
        }
        if (maxIterations < 0) {
            throw new IllegalArgumentException("maxIterations must be >= 0, got: " + maxIterations);
        }
    }

    // ========================================================================
    // FACTORIES
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Built-in defaults, ignoring properties files and the environment.
     */
    public static RewriterConfig defaults() {
        return builder().build();
    }

    /**
     * Load configuration from {@value #DEFAULT_PROPERTIES_FILE}.
     */
    public static RewriterConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES_FILE);
    }

    /**
     * Load configuration from a properties file, searching the classpath root first and
     * then the file system. Environment variables override file values.
     *
     * @param propertiesPath Path to properties file
     * @return Configuration loaded from properties file
     */
    public static RewriterConfig loadFromProperties(String propertiesPath) {
        return loadFromProperties(propertiesPath, System.getenv());
    }

    /**
     * Same as {@link #loadFromProperties(String)} with an explicit environment.
     */
    public static RewriterConfig loadFromProperties(String propertiesPath, Map<String, String> environment) {
        logger.info("Loading rewriter configuration from: " + propertiesPath);

        Properties props = new Properties();

        // Try classpath first
        try (InputStream is = RewriterConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        // Try file system if not found in classpath
        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (IOException e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = builder();
        applyProperties(builder, props);
        applyEnvironment(builder, environment);
        return builder.build();
    }

    private static void applyProperties(Builder builder, Properties props) {
        String ruleSets = props.getProperty(PROP_RULE_SETS);
        if (ruleSets != null) {
            parseList(PROP_RULE_SETS, ruleSets).ifPresent(builder::ruleSets);
        }

        String maxIterations = props.getProperty(PROP_MAX_ITERATIONS);
        if (maxIterations != null) {
            parseInt(PROP_MAX_ITERATIONS, maxIterations).ifPresent(builder::maxIterations);
        }

        String strategy = props.getProperty(PROP_STRATEGY);
        if (strategy != null) {
            parseStrategy(PROP_STRATEGY, strategy).ifPresent(builder::strategy);
        }

        String extraChecks = props.getProperty(PROP_EXTRA_RULE_CHECKS);
        if (extraChecks != null) {
            builder.extraRuleChecks(Boolean.parseBoolean(extraChecks.trim()));
        }

        String traceEnabled = props.getProperty(PROP_TRACE_ENABLED);
        if (traceEnabled != null) {
            builder.traceEnabled(Boolean.parseBoolean(traceEnabled.trim()));
        }
    }

    private static void applyEnvironment(Builder builder, Map<String, String> environment) {
        getEnv(environment, ENV_RULE_SETS)
                .flatMap(v -> parseList(ENV_RULE_SETS, v))
                .ifPresent(builder::ruleSets);
        getEnv(environment, ENV_MAX_ITERATIONS)
                .flatMap(v -> parseInt(ENV_MAX_ITERATIONS, v))
                .ifPresent(builder::maxIterations);
        getEnv(environment, ENV_STRATEGY)
                .flatMap(v -> parseStrategy(ENV_STRATEGY, v))
                .ifPresent(builder::strategy);
        getEnv(environment, ENV_EXTRA_RULE_CHECKS).map(Boolean::parseBoolean).ifPresent(builder::extraRuleChecks);
        getEnv(environment, ENV_TRACE_ENABLED).map(Boolean::parseBoolean).ifPresent(builder::traceEnabled);
    }

    // ========================================================================
    // PARSING HELPERS
    // ========================================================================

    private static Optional<String> getEnv(Map<String, String> environment, String key) {
        String value = environment.get(key);
        if (value != null && !value.trim().isEmpty()) {
            logger.fine("Loaded env var: " + key + "=" + value);
            return Optional.of(value.trim());
        }
        return Optional.empty();
    }

    private static Optional<List<String>> parseList(String key, String value) {
        List<String> names = Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (names.isEmpty()) {
            logger.warning("No rule set names in " + key + ": '" + value + "'");
            return Optional.empty();
        }
        return Optional.of(names);
    }

    private static Optional<Integer> parseInt(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warning("Invalid integer value for " + key + ": " + value);
            return Optional.empty();
        }
        if (parsed < 0) {
            logger.warning("Negative value for " + key + ": " + value);
            return Optional.empty();
        }
        return Optional.of(parsed);
    }

    private static Optional<SelectionStrategy> parseStrategy(String key, String value) {
        try {
            return Optional.of(SelectionStrategy.valueOf(value.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            logger.warning("Invalid selection strategy for " + key + ": " + value);
            return Optional.empty();
        }
    }

    // ========================================================================
    // ACCESSORS
    // ========================================================================

    public List<String> ruleSets() {
        return ruleSets;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public SelectionStrategy strategy() {
        return strategy;
    }

    public boolean extraRuleChecks() {
        return extraRuleChecks;
    }

    public boolean traceEnabled() {
        return traceEnabled;
    }

    /**
     * Run options for this configuration, with no cancellation token.
     */
    public RewriteOptions toOptions() {
        return new RewriteOptions(maxIterations, strategy, CancellationToken.none(), extraRuleChecks, traceEnabled);
    }

    @Override
    public String toString() {
        return String.format(
                "RewriterConfig{ruleSets=%s, maxIterations=%d, strategy=%s, extraRuleChecks=%s, traceEnabled=%s}",
                ruleSets, maxIterations, strategy, extraRuleChecks, traceEnabled);
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private List<String> ruleSets = DEFAULT_RULE_SETS;
        private int maxIterations = RewriteOptions.DEFAULT_MAX_ITERATIONS;
        private SelectionStrategy strategy = SelectionStrategy.PRIORITY;
        private boolean extraRuleChecks = false;
        private boolean traceEnabled = true;

        private Builder() {
        }

        public Builder ruleSets(List<String> ruleSets) {
            this.ruleSets = List.copyOf(ruleSets);
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder strategy(SelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder extraRuleChecks(boolean extraRuleChecks) {
            this.extraRuleChecks = extraRuleChecks;
            return this;
        }

        public Builder traceEnabled(boolean traceEnabled) {
            this.traceEnabled = traceEnabled;
            return this;
        }

        public RewriterConfig build() {
            return new RewriterConfig(this);
        }
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine.trace;

import com.essence.rewriter.api.model.RewriteTrace;
import com.essence.rewriter.api.model.TraceEntry;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.model.Declaration;
import com.essence.rewriter.rule.RuleSetMembership;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link RewriteTrace} as JSON for tooling.
 *
 * <pre>{@code
 * {
 *   "initial_model" : "...",
 *   "steps" : [ {
 *     "step" : 1,
 *     "before" : "allDiff([a, b, c;int(1..3)])",
 *     "rule" : "normalise_matrix_index_domain",
 *     "rule_sets" : [ { "name" : "Base", "priority" : 2000 } ],
 *     "after" : [ "..." ],
 *     "path" : "/0/0"
 *   } ],
 *   "final_model" : "..."
 * }
 * }</pre>
 *
 * {@code final_model} is {@code null} for a run that did not reach a fixpoint.
 * {@code new_constraints} and {@code new_variables} appear only on steps that have them.
 */
public final class TraceJsonWriter {

    private final ObjectMapper mapper;

    public TraceJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public TraceJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toTree(RewriteTrace trace) {
        ObjectNode root = mapper.createObjectNode();
        root.put("initial_model", trace.initialModel());

        ArrayNode steps = root.putArray("steps");
        for (TraceEntry entry : trace.entries()) {
            steps.add(toTree(entry));
        }

        if (trace.finalModel().isPresent()) {
            root.put("final_model", trace.finalModel().get());
        } else {
            root.putNull("final_model");
        }
        return root;
    }

    private ObjectNode toTree(TraceEntry entry) {
        ObjectNode node = mapper.createObjectNode();
        node.put("step", entry.step());
        node.put("before", entry.before().toString());
        node.put("rule", entry.ruleName());

        ArrayNode ruleSets = node.putArray("rule_sets");
        for (RuleSetMembership membership : entry.ruleSets()) {
            ruleSets.addObject()
                    .put("name", membership.ruleSet())
                    .put("priority", membership.priority());
        }

        ArrayNode after = node.putArray("after");
        entry.after().forEach(e -> after.add(e.toString()));

        if (!entry.newTopLevel().isEmpty()) {
            ArrayNode constraints = node.putArray("new_constraints");
            for (Expression constraint : entry.newTopLevel()) {
                constraints.add(constraint.toString());
            }
        }
        if (!entry.newSymbols().isEmpty()) {
            ArrayNode variables = node.putArray("new_variables");
            for (Declaration declaration : entry.newSymbols()) {
                variables.add(declaration.toString());
            }
        }

        node.put("path", entry.path().toString());
        return node;
    }

    /**
     * @throws UncheckedIOException if serialization fails
     */
    public String toJson(RewriteTrace trace) {
        try {
            return mapper.writeValueAsString(toTree(trace));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize rewrite trace", e);
        }
    }

    /**
     * Writes the trace to {@code file}, replacing any existing content.
     */
    public void write(RewriteTrace trace, Path file) throws IOException {
        Files.writeString(file, toJson(trace));
    }
}

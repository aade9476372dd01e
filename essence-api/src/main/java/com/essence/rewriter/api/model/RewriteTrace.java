/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a trace: the model before rewriting, the accepted rewrites
 * in application order and, once the run reached a fixpoint, the final model.
 * Models are kept in their pretty-printed form.
 */
public record RewriteTrace(String initialModel, List<TraceEntry> entries, Optional<String> finalModel) {

    public RewriteTrace {
        entries = List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isFinalised() {
        return finalModel.isPresent();
    }

    public List<String> ruleNames() {
        return entries.stream().map(TraceEntry::ruleName).toList();
    }
}

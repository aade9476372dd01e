/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine.trace;

import com.essence.rewriter.api.model.RewriteTrace;
import com.essence.rewriter.api.model.TraceEntry;
import com.essence.rewriter.model.Model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log of one rewrite run.
 *
 * <p>Owned by a single run and never shared. Models are captured in their printed
 * form when recorded, so later mutation of the working model cannot alter the log.
 * When disabled, {@link #record(TraceEntry)} is a no-op but the initial and final
 * models are still captured.
 */
public final class TraceRecorder {

    private final boolean enabled;
    private final List<TraceEntry> entries = new ArrayList<>();
    private String initialModel;
    private String finalModel;

    public TraceRecorder(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Captures the model before the first rewrite.
     *
     * @throws IllegalStateException if called twice
     */
    public void begin(Model model) {
        if (initialModel != null) {
            throw new IllegalStateException("Trace already started");
        }
        initialModel = model.toString();
    }

    public void record(TraceEntry entry) {
        requireStarted();
        if (finalModel != null) {
            throw new IllegalStateException("Trace already finalised");
        }
        if (enabled) {
            entries.add(entry);
        }
    }

    /**
     * Captures the model at the fixpoint. Only a run that reached a fixpoint is finalised.
     */
    public void finalise(Model model) {
        requireStarted();
        finalModel = model.toString();
    }

    /**
     * Immutable snapshot of what has been recorded so far.
     */
    public RewriteTrace trace() {
        requireStarted();
        return new RewriteTrace(initialModel, entries, Optional.ofNullable(finalModel));
    }

    public boolean isEnabled() {
        return enabled;
    }

    private void requireStarted() {
        if (initialModel == null) {
            throw new IllegalStateException("Trace not started");
        }
    }
}

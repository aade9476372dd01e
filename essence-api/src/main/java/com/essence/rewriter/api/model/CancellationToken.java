/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal, checked by the engine between steps (never mid-step).
 * Safe to cancel from another thread.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * A token nobody holds; never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared 'none' token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}

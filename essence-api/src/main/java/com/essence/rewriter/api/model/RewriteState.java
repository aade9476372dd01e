/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

/**
 * States of a single rewrite run.
 */
public enum RewriteState {
    /**
     * Enumerating subterms and evaluating rule conditions.
     */
    SCANNING,

    /**
     * Transforming the selected candidate and splicing the result into the model.
     */
    APPLYING,

    /**
     * No rule applies anywhere; the model is final.
     */
    FIXED
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.api.model;

/**
 * How the engine ranks applicable (subterm, rule) candidates.
 */
public enum SelectionStrategy {
    /**
     * Highest priority wins across the whole model. Ties go to the rule set
     * configured first, then to the subterm discovered first in pre-order,
     * then to the rule registered first.
     */
    PRIORITY,

    /**
     * Top-down, left to right: the first subterm in pre-order that any rule
     * applies to wins; among rules applicable there, the priority order of
     * {@link #PRIORITY} decides.
     */
    NODE_FIRST
}

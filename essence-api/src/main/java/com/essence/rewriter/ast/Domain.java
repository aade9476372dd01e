/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.ast;

/**
 * Set of values a decision variable (or a matrix index) may take.
 */
public sealed interface Domain permits BoolDomain, IntDomain {

    /**
     * True if every value of the domain is known, i.e. all ranges have both bounds.
     */
    boolean isBounded();
}

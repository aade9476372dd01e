/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.term;

/**
 * A node found while enumerating a tree, together with where it was found.
 *
 * @param term the node
 * @param path position from the root
 * @param parent the enclosing node, or {@code null} for the root
 * @param <T> the node type
 */
public record Subterm<T extends Term<T>>(T term, TermPath path, T parent) {

    /**
     * True if a multi-term replacement of this node can be spliced into its
     * context: the node is the root, or its parent is variadic.
     */
    public boolean inVariadicContext() {
        return parent == null || parent.isVariadic();
    }
}

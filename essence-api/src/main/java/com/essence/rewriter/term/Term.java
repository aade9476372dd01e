/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.term;

import java.util.List;

/**
 * A node of a tree that can be traversed and rebuilt generically.
 *
 * <p>Every node type declares its children explicitly; there is no reflection.
 * The contract every implementation must honour:
 * <ul>
 *   <li>{@link #children()} returns exactly the children the node stores, in order
 *       (empty for leaves).</li>
 *   <li>{@code node.withChildren(node.children())} is equal to {@code node}.</li>
 *   <li>{@link #withChildren(List)} rejects a list of the wrong size or kind with a
 *       {@link com.essence.rewriter.api.exceptions.MalformedReconstructionException}.
 *       Variadic nodes accept any size.</li>
 * </ul>
 *
 * @param <T> the node type
 */
public interface Term<T extends Term<T>> {

    /**
     * Immediate children of this node, in order.
     */
    List<T> children();

    /**
     * Rebuilds a node of the same kind with the given children substituted.
     *
     * @param children replacement children
     * @return a new node (or this node if nothing changed)
     */
    T withChildren(List<T> children);

    /**
     * True if one child of this node may be replaced by zero or more terms
     * (the node is a conjunctive list context).
     */
    default boolean isVariadic() {
        return false;
    }
}

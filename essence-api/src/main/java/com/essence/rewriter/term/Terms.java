/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.term;

import com.essence.rewriter.api.exceptions.MalformedReconstructionException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Generic traversal and reconstruction over any {@link Term}.
 *
 * <p>Nothing here knows about rules; it only understands tree shape:
 * <ul>
 *   <li>{@link #universe(Term)} / {@link #universeWithPaths(Term)} - pre-order enumeration</li>
 *   <li>{@link #transformBottomUp} / {@link #transformTopDown} - context-free rewrite-all</li>
 *   <li>{@link #rewrite} - bottom-up rewrite to a local fixpoint</li>
 *   <li>{@link #replaceAt} - substitute or splice a replacement at a path</li>
 * </ul>
 */
public final class Terms {

    private Terms() {
        throw new AssertionError("No instances");
    }

    /**
     * The node itself and every descendant, in pre-order (node first, then
     * children left to right).
     */
    public static <T extends Term<T>> List<T> universe(T root) {
        List<T> result = new ArrayList<>();
        Deque<T> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            T node = stack.pop();
            result.add(node);
            List<T> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Same order as {@link #universe(Term)}, each node paired with its path and parent.
     * The list index of an entry is its discovery index.
     */
    public static <T extends Term<T>> List<Subterm<T>> universeWithPaths(T root) {
        List<Subterm<T>> result = new ArrayList<>();
        collect(root, TermPath.root(), null, result);
        return result;
    }

    private static <T extends Term<T>> void collect(T node, TermPath path, T parent, List<Subterm<T>> out) {
        out.add(new Subterm<>(node, path, parent));
        List<T> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            collect(children.get(i), path.child(i), node, out);
        }
    }

    /**
     * Node at the given path.
     *
     * @throws IllegalArgumentException if the path leaves the tree
     */
    public static <T extends Term<T>> T get(T root, TermPath path) {
        T node = root;
        for (int level = 0; level < path.depth(); level++) {
            List<T> children = node.children();
            int index = path.index(level);
            if (index < 0 || index >= children.size()) {
                throw new IllegalArgumentException("Path " + path + " does not exist in " + root);
            }
            node = children.get(index);
        }
        return node;
    }

    /**
     * Applies {@code f} to every node, children before parents, rebuilding as it goes.
     */
    public static <T extends Term<T>> T transformBottomUp(T node, UnaryOperator<T> f) {
        List<T> children = node.children();
        if (children.isEmpty()) {
            return f.apply(node);
        }
        List<T> transformed = new ArrayList<>(children.size());
        boolean changed = false;
        for (T child : children) {
            T newChild = transformBottomUp(child, f);
            changed |= newChild != child;
            transformed.add(newChild);
        }
        return f.apply(changed ? node.withChildren(transformed) : node);
    }

    /**
     * Applies {@code f} to every node, parents before children. The children visited
     * are those of the node {@code f} returned.
     */
    public static <T extends Term<T>> T transformTopDown(T node, UnaryOperator<T> f) {
        T current = f.apply(node);
        List<T> children = current.children();
        if (children.isEmpty()) {
            return current;
        }
        List<T> transformed = new ArrayList<>(children.size());
        boolean changed = false;
        for (T child : children) {
            T newChild = transformTopDown(child, f);
            changed |= newChild != child;
            transformed.add(newChild);
        }
        return changed ? current.withChildren(transformed) : current;
    }

    /**
     * Bottom-up rewrite until {@code f} declines every node. Whenever {@code f}
     * rewrites a node, the result is rewritten again.
     */
    public static <T extends Term<T>> T rewrite(T node, Function<T, Optional<T>> f) {
        return transformBottomUp(node, n -> {
            Optional<T> next = f.apply(n);
            return next.isPresent() ? rewrite(next.get(), f) : n;
        });
    }

    /**
     * Replaces the node at {@code path} with {@code replacement}.
     *
     * <ul>
     *   <li>One replacement term: ordinary substitution.</li>
     *   <li>Any other count, parent variadic: the terms are spliced in place of the
     *       original child, sibling order preserved.</li>
     *   <li>Any other count, path is the root: {@code rootJoiner} combines them.</li>
     *   <li>Otherwise: {@link MalformedReconstructionException}.</li>
     * </ul>
     *
     * @return the new root
     */
    public static <T extends Term<T>> T replaceAt(T root, TermPath path, List<T> replacement,
                                                  Function<List<T>, T> rootJoiner) {
        if (path.isRoot()) {
            return replacement.size() == 1 ? replacement.get(0) : rootJoiner.apply(List.copyOf(replacement));
        }
        return rebuild(root, path, 0, replacement);
    }

    private static <T extends Term<T>> T rebuild(T node, TermPath path, int level, List<T> replacement) {
        List<T> children = node.children();
        int index = path.index(level);
        if (index < 0 || index >= children.size()) {
            throw new MalformedReconstructionException("Path " + path + " does not exist under " + node);
        }
        List<T> newChildren = new ArrayList<>(children);
        if (level == path.depth() - 1) {
            if (replacement.size() == 1) {
                newChildren.set(index, replacement.get(0));
            } else if (node.isVariadic()) {
                newChildren.remove(index);
                newChildren.addAll(index, replacement);
            } else {
                throw new MalformedReconstructionException(String.format(
                        "Cannot substitute %d terms for child %d of non-variadic %s",
                        replacement.size(), index, node));
            }
        } else {
            newChildren.set(index, rebuild(children.get(index), path, level + 1, replacement));
        }
        return node.withChildren(newChildren);
    }

    /**
     * Checks a proposed child list against a fixed arity.
     *
     * @throws MalformedReconstructionException if the sizes differ
     */
    public static void requireArity(Object node, List<?> children, int expected) {
        if (children.size() != expected) {
            throw new MalformedReconstructionException(String.format(
                    "%s expects %d children, got %d", node.getClass().getSimpleName(), expected, children.size()));
        }
    }
}

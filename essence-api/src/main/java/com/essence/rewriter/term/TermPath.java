/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.term;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Position of a subterm inside a tree, as the child indices walked from the root.
 * The root itself has the empty path.
 */
public final class TermPath implements Comparable<TermPath> {

    private static final TermPath ROOT = new TermPath(IntLists.emptyList());

    private final IntList indices;

    private TermPath(IntList indices) {
        this.indices = indices;
    }

    public static TermPath root() {
        return ROOT;
    }

    public static TermPath of(int... indices) {
        return new TermPath(IntLists.unmodifiable(new IntArrayList(indices)));
    }

    /**
     * Path of the {@code index}-th child of the node at this path.
     */
    public TermPath child(int index) {
        IntArrayList extended = new IntArrayList(indices.size() + 1);
        extended.addAll(indices);
        extended.add(index);
        return new TermPath(IntLists.unmodifiable(extended));
    }

    public TermPath parent() {
        if (isRoot()) {
            throw new IllegalStateException("Root path has no parent");
        }
        return new TermPath(IntLists.unmodifiable(new IntArrayList(indices.subList(0, indices.size() - 1))));
    }

    public boolean isRoot() {
        return indices.isEmpty();
    }

    public int depth() {
        return indices.size();
    }

    public int index(int level) {
        return indices.getInt(level);
    }

    public int lastIndex() {
        if (isRoot()) {
            throw new IllegalStateException("Root path has no index");
        }
        return indices.getInt(indices.size() - 1);
    }

    /**
     * True if this path lies at or below {@code ancestor}.
     */
    public boolean startsWith(TermPath ancestor) {
        if (ancestor.depth() > depth()) {
            return false;
        }
        for (int i = 0; i < ancestor.depth(); i++) {
            if (index(i) != ancestor.index(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(TermPath other) {
        int common = Math.min(depth(), other.depth());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(index(i), other.index(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(depth(), other.depth());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TermPath)) return false;
        return indices.equals(((TermPath) o).indices);
    }

    @Override
    public int hashCode() {
        return indices.hashCode();
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indices.size(); i++) {
            sb.append('/').append(indices.getInt(i));
        }
        return sb.toString();
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine;

import com.essence.rewriter.rule.RuleIgnoreException;
import com.essence.rewriter.term.TermPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Regions of the tree withdrawn from the current step by a rule that threw
 * {@link RuleIgnoreException}. Lives for one step only.
 */
final class SkippedSubtrees {

    private record Region(TermPath origin, int depth, String ruleName) {

        boolean contains(TermPath path) {
            return path.startsWith(origin) && path.depth() - origin.depth() <= depth;
        }
    }

    private final List<Region> regions = new ArrayList<>();

    void skip(TermPath origin, String ruleName, RuleIgnoreException signal) {
        regions.add(new Region(origin, signal.getDepth(), ruleName));
    }

    boolean contains(TermPath path) {
        for (Region region : regions) {
            if (region.contains(path)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rule behind each region, in the order the regions were withdrawn.
     */
    List<String> ruleNames() {
        List<String> names = new ArrayList<>(regions.size());
        for (Region region : regions) {
            names.add(region.ruleName());
        }
        return names;
    }
}

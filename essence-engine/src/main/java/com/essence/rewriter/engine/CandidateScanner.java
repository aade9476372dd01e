/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.engine;

import com.essence.rewriter.api.exceptions.RewriteException;
import com.essence.rewriter.api.model.SelectionStrategy;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.Root;
import com.essence.rewriter.engine.ActiveRules.ActiveRule;
import com.essence.rewriter.model.Symbols;
import com.essence.rewriter.rule.RuleIgnoreException;
import com.essence.rewriter.rule.RuleNotApplicableException;
import com.essence.rewriter.term.Subterm;
import com.essence.rewriter.term.Terms;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates every (subterm, rule) pair whose condition holds and ranks them.
 *
 * <p>Conditions are evaluated against an immutable root, so the result is a pure
 * function of the model and the active rules. Rules that require a variadic
 * context are only tested on subterms sitting directly in a conjunctive list.
 *
 * <p>A condition that throws {@link RuleIgnoreException} withdraws its subterm,
 * and the levels below it that the exception names, from the scan. Candidates
 * already found on that subterm are dropped and no rule is tested on the
 * withdrawn nodes.
 */
final class CandidateScanner {

    private CandidateScanner() {
    }

    /**
     * @param step    the step about to be attempted, for error context
     * @param skipped regions withdrawn from this step; extended by ignoring conditions
     * @return applicable candidates, best first
     * @throws RewriteException if a condition fails, annotated with rule, term and step
     */
    static List<Candidate> scan(Root root, Symbols symbols, ActiveRules rules, SelectionStrategy strategy,
                                int step, SkippedSubtrees skipped) {
        List<Subterm<Expression>> subterms = Terms.universeWithPaths(root);
        List<Candidate> candidates = new ArrayList<>();

        for (int index = 0; index < subterms.size(); index++) {
            Subterm<Expression> subterm = subterms.get(index);
            if (skipped.contains(subterm.path())) {
                continue;
            }
            for (ActiveRule rule : rules.rules()) {
                if (rule.rule().requiresVariadicContext() && !subterm.inVariadicContext()) {
                    continue;
                }
                try {
                    if (test(rule, subterm.term(), symbols, step)) {
                        candidates.add(new Candidate(subterm, index, rule));
                    }
                } catch (RuleIgnoreException e) {
                    skipped.skip(subterm.path(), rule.name(), e);
                    candidates.removeIf(candidate -> skipped.contains(candidate.subterm().path()));
                    break;
                }
            }
        }

        candidates.sort(Candidate.order(strategy));
        return candidates;
    }

    private static boolean test(ActiveRule rule, Expression term, Symbols symbols, int step) {
        try {
            return rule.rule().isApplicable(term, symbols);
        } catch (RuleNotApplicableException e) {
            return false;
        } catch (RuleIgnoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw RuleFailures.withContext(e, rule.name(), term.toString(), step);
        }
    }
}

/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rules.minion;

import com.essence.rewriter.ast.AllDiff;
import com.essence.rewriter.ast.BoolDomain;
import com.essence.rewriter.ast.Domain;
import com.essence.rewriter.ast.Eq;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.FlatAllDiff;
import com.essence.rewriter.ast.FlatSumGeq;
import com.essence.rewriter.ast.FlatSumLeq;
import com.essence.rewriter.ast.IntConstant;
import com.essence.rewriter.ast.IntDomain;
import com.essence.rewriter.ast.MatrixLiteral;
import com.essence.rewriter.ast.Name;
import com.essence.rewriter.ast.Not;
import com.essence.rewriter.ast.Range;
import com.essence.rewriter.ast.Reference;
import com.essence.rewriter.ast.Sum;
import com.essence.rewriter.ast.WatchedLiteral;
import com.essence.rewriter.model.Declaration;
import com.essence.rewriter.model.Symbols;
import com.essence.rewriter.rule.Reduction;
import com.essence.rewriter.rule.Rule;
import com.essence.rewriter.rule.RuleNotApplicableException;
import com.essence.rewriter.rule.RuleSet;
import com.essence.rewriter.rules.base.BaseRules;
import com.essence.rewriter.rules.registry.RuleModule;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowering to Minion's native constraints: the {@code "Minion"} rule set, which
 * depends on {@code "Base"}.
 *
 * <p>Every rule here except {@code flatten_sum_operand} turns a top-level
 * constraint into solver-native constraints, so they only fire where the matched
 * term is a constraint in its own right.
 */
public final class MinionRules implements RuleModule {

    public static final String RULE_SET = "Minion";

    public static final String FLATTEN_ALL_DIFF = "flatten_all_diff";
    public static final String LITERAL_TO_WATCHED_LITERAL = "literal_to_watched_literal";
    public static final String SUM_EQ_TO_INEQUALITIES = "sum_eq_to_inequalities";
    public static final String FLATTEN_SUM_OPERAND = "flatten_sum_operand";

    @Override
    public String name() {
        return "minion";
    }

    @Override
    public List<RuleSet> ruleSets() {
        return List.of(RuleSet.of(RULE_SET, BaseRules.RULE_SET));
    }

    @Override
    public List<Rule> rules() {
        return List.of(flattenAllDiff(), literalToWatchedLiteral(), sumEqToInequalities(), flattenSumOperand());
    }

    /**
     * {@code allDiff([a, b, c;int(1..)])} becomes {@code __flat_alldiff([a, b, c])}.
     * Waits for the index domain to be normalised.
     */
    static Rule flattenAllDiff() {
        return Rule.builder(FLATTEN_ALL_DIFF)
                .condition((term, symbols) -> term instanceof AllDiff allDiff
                        && allDiff.operand() instanceof MatrixLiteral matrix
                        && hasOpenIndex(matrix)
                        && matrix.elements().stream().allMatch(Expression::isAtomic))
                .transform((term, symbols) -> {
                    MatrixLiteral matrix = (MatrixLiteral) ((AllDiff) term).operand();
                    return Reduction.pure(new FlatAllDiff(matrix.elements()));
                })
                .ruleSet(RULE_SET, 4200)
                .requiresVariadicContext()
                .build();
    }

    /**
     * A boolean variable {@code x} as a constraint becomes {@code WatchedLiteral(x,true)},
     * and {@code !(x)} becomes {@code WatchedLiteral(x,false)}.
     */
    static Rule literalToWatchedLiteral() {
        return Rule.builder(LITERAL_TO_WATCHED_LITERAL)
                .condition((term, symbols) -> literal(term, symbols) != null)
                .transform((term, symbols) -> {
                    Name name = literal(term, symbols);
                    if (name == null) {
                        throw new RuleNotApplicableException("Not a boolean literal: " + term);
                    }
                    return Reduction.pure(new WatchedLiteral(name, !(term instanceof Not)));
                })
                .ruleSet(RULE_SET, 4100)
                .requiresVariadicContext()
                .build();
    }

    /**
     * {@code sum([a, b]) = c} becomes the pair {@code __flat_sumleq([a, b],c)},
     * {@code __flat_sumgeq([a, b],c)}, spliced into the constraint list.
     */
    static Rule sumEqToInequalities() {
        return Rule.builder(SUM_EQ_TO_INEQUALITIES)
                .condition((term, symbols) -> term instanceof Eq eq && flatSumEquation(eq) != null)
                .transform((term, symbols) -> {
                    Expression[] equation = flatSumEquation((Eq) term);
                    if (equation == null) {
                        throw new RuleNotApplicableException("Not a flat sum equation: " + term);
                    }
                    List<Expression> operands = ((Sum) equation[0]).operands();
                    return Reduction.splice(List.of(
                            new FlatSumLeq(operands, equation[1]),
                            new FlatSumGeq(operands, equation[1])));
                })
                .ruleSet(RULE_SET, 4200)
                .requiresVariadicContext()
                .build();
    }

    /**
     * Replaces the first operand of a sum that is itself a sum of atoms with a fresh
     * auxiliary variable {@code __n}, adding {@code sum(inner) = __n} as a new
     * top-level constraint. Declines when the inner sum's bounds are unknown.
     */
    static Rule flattenSumOperand() {
        return Rule.builder(FLATTEN_SUM_OPERAND)
                .condition((term, symbols) -> term instanceof Sum sum && nestedFlatSum(sum) >= 0)
                .transform((term, symbols) -> {
                    Sum sum = (Sum) term;
                    int index = nestedFlatSum(sum);
                    if (index < 0) {
                        throw new RuleNotApplicableException("No nested flat sum in " + term);
                    }
                    Sum inner = (Sum) sum.operands().get(index);
                    Domain domain = boundsOf(inner, symbols);
                    Name aux = symbols.freshNames(1).get(0);

                    List<Expression> operands = new ArrayList<>(sum.operands());
                    operands.set(index, new Reference(aux));
                    return Reduction.pure(new Sum(operands))
                            .withTopLevel(new Eq(inner, new Reference(aux)))
                            .withSymbol(new Declaration(aux, domain));
                })
                .ruleSet(RULE_SET, 4400)
                .build();
    }

    // ========================================================================
    // MATCHING HELPERS
    // ========================================================================

    private static boolean hasOpenIndex(MatrixLiteral matrix) {
        if (matrix.index() instanceof IntDomain domain && domain.ranges().size() == 1) {
            Range range = domain.ranges().get(0);
            return range.lower() != null && range.upper() == null;
        }
        return false;
    }

    /**
     * Name of the boolean variable {@code term} asserts or negates, or {@code null}.
     *
     * @throws com.essence.rewriter.api.exceptions.UnresolvedIdentifierException if the
     *         reference is not declared
     */
    private static Name literal(Expression term, Symbols symbols) {
        Expression target = term instanceof Not not ? not.operand() : term;
        if (target instanceof Reference reference
                && symbols.lookup(reference.name()).domain() instanceof BoolDomain) {
            return reference.name();
        }
        return null;
    }

    /**
     * {@code [sum, bound]} if {@code eq} equates a sum of atoms with an atom in either
     * orientation, else {@code null}.
     */
    private static Expression[] flatSumEquation(Eq eq) {
        if (isFlatSum(eq.left()) && eq.right().isAtomic()) {
            return new Expression[]{eq.left(), eq.right()};
        }
        if (isFlatSum(eq.right()) && eq.left().isAtomic()) {
            return new Expression[]{eq.right(), eq.left()};
        }
        return null;
    }

    private static boolean isFlatSum(Expression expression) {
        return expression instanceof Sum sum
                && !sum.operands().isEmpty()
                && sum.operands().stream().allMatch(Expression::isAtomic);
    }

    private static int nestedFlatSum(Sum sum) {
        List<Expression> operands = sum.operands();
        for (int i = 0; i < operands.size(); i++) {
            if (isFlatSum(operands.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static IntDomain boundsOf(Sum sum, Symbols symbols) {
        long lower = 0;
        long upper = 0;
        for (Expression operand : sum.operands()) {
            if (operand instanceof IntConstant constant) {
                lower += constant.value();
                upper += constant.value();
            } else if (operand instanceof Reference reference
                    && symbols.lookup(reference.name()).domain() instanceof IntDomain domain
                    && domain.isBounded()) {
                lower += domain.min().getAsInt();
                upper += domain.max().getAsInt();
            } else {
                throw new RuleNotApplicableException("Unbounded sum operand: " + operand);
            }
        }
        if (lower < Integer.MIN_VALUE || upper > Integer.MAX_VALUE) {
            throw new RuleNotApplicableException("Sum bounds overflow: " + sum);
        }
        return IntDomain.bounded((int) lower, (int) upper);
    }
}

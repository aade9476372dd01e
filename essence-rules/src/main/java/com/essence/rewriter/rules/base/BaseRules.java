/*
 * Copyright (c) 2025 Essence Rewriter
 * Licensed under the Apache License, Version 2.0
 */
package com.essence.rewriter.rules.base;

import com.essence.rewriter.ast.And;
import com.essence.rewriter.ast.BoolConstant;
import com.essence.rewriter.ast.Eq;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.Iff;
import com.essence.rewriter.ast.IntConstant;
import com.essence.rewriter.ast.IntDomain;
import com.essence.rewriter.ast.Leq;
import com.essence.rewriter.ast.MatrixLiteral;
import com.essence.rewriter.ast.Neq;
import com.essence.rewriter.ast.Not;
import com.essence.rewriter.ast.Or;
import com.essence.rewriter.ast.Range;
import com.essence.rewriter.ast.Root;
import com.essence.rewriter.ast.Sum;
import com.essence.rewriter.rule.Reduction;
import com.essence.rewriter.rule.Rule;
import com.essence.rewriter.rule.RuleNotApplicableException;
import com.essence.rewriter.rule.RuleSet;
import com.essence.rewriter.rules.registry.RuleModule;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Solver-independent simplifications: the {@code "Base"} rule set.
 *
 * <table>
 *   <caption>Rules</caption>
 *   <tr><th>Rule</th><th>Priority</th><th>Effect</th></tr>
 *   <tr><td>partial_evaluator</td><td>9000</td><td>folds constants and trivial identities</td></tr>
 *   <tr><td>normalise_matrix_index_domain</td><td>2000</td><td>{@code int(l..u)} index becomes {@code int(l..)}</td></tr>
 *   <tr><td>remove_unit_conjunction</td><td>2000</td><td>{@code and([e])} becomes {@code e}</td></tr>
 *   <tr><td>flatten_conjunction</td><td>1000</td><td>splices a conjunction into the enclosing constraint list</td></tr>
 * </table>
 */
public final class BaseRules implements RuleModule {

    public static final String RULE_SET = "Base";

    public static final String PARTIAL_EVALUATOR = "partial_evaluator";
    public static final String NORMALISE_MATRIX_INDEX_DOMAIN = "normalise_matrix_index_domain";
    public static final String REMOVE_UNIT_CONJUNCTION = "remove_unit_conjunction";
    public static final String FLATTEN_CONJUNCTION = "flatten_conjunction";

    @Override
    public String name() {
        return "base";
    }

    @Override
    public List<RuleSet> ruleSets() {
        return List.of(RuleSet.of(RULE_SET));
    }

    @Override
    public List<Rule> rules() {
        return List.of(partialEvaluator(), normaliseMatrixIndexDomain(), removeUnitConjunction(), flattenConjunction());
    }

    static Rule partialEvaluator() {
        return Rule.builder(PARTIAL_EVALUATOR)
                .condition((term, symbols) -> evaluate(term).isPresent())
                .transform((term, symbols) -> Reduction.pure(evaluate(term)
                        .orElseThrow(() -> new RuleNotApplicableException("Nothing to evaluate in " + term))))
                .ruleSet(RULE_SET, 9000)
                .build();
    }

    static Rule normaliseMatrixIndexDomain() {
        return Rule.builder(NORMALISE_MATRIX_INDEX_DOMAIN)
                .condition((term, symbols) -> term instanceof MatrixLiteral matrix && closedLowerBound(matrix).isPresent())
                .transform((term, symbols) -> {
                    MatrixLiteral matrix = (MatrixLiteral) term;
                    int lower = closedLowerBound(matrix)
                            .orElseThrow(() -> new RuleNotApplicableException("Index domain already open"));
                    return Reduction.pure(matrix.withIndex(IntDomain.of(Range.from(lower))));
                })
                .ruleSet(RULE_SET, 2000)
                .build();
    }

    static Rule removeUnitConjunction() {
        return Rule.builder(REMOVE_UNIT_CONJUNCTION)
                .condition((term, symbols) -> term instanceof And and && and.operands().size() == 1)
                .transform((term, symbols) -> Reduction.pure(((And) term).operands().get(0)))
                .ruleSet(RULE_SET, 2000)
                .build();
    }

    static Rule flattenConjunction() {
        return Rule.builder(FLATTEN_CONJUNCTION)
                .condition((term, symbols) -> term instanceof And and && and.operands().size() > 1)
                .transform((term, symbols) -> Reduction.splice(((And) term).operands()))
                .ruleSet(RULE_SET, 1000)
                .requiresVariadicContext()
                .build();
    }

    // ========================================================================
    // PARTIAL EVALUATION
    // ========================================================================

    /**
     * One simplification step at the top of {@code term}, or empty if none applies.
     * Every step strictly shrinks the term.
     */
    static Optional<Expression> evaluate(Expression term) {
        if (term instanceof Not not) {
            return evaluateNot(not);
        }
        if (term instanceof And and) {
            return evaluateAnd(and);
        }
        if (term instanceof Or or) {
            return evaluateOr(or);
        }
        if (term instanceof Iff iff) {
            return evaluateIff(iff);
        }
        if (term instanceof Eq eq) {
            return evaluateEq(eq.left(), eq.right()).map(BoolConstant::of);
        }
        if (term instanceof Neq neq) {
            return evaluateEq(neq.left(), neq.right()).map(equal -> BoolConstant.of(!equal));
        }
        if (term instanceof Leq leq) {
            if (leq.left() instanceof IntConstant l && leq.right() instanceof IntConstant r) {
                return Optional.of(BoolConstant.of(l.value() <= r.value()));
            }
            return Optional.empty();
        }
        if (term instanceof Sum sum) {
            return evaluateSum(sum);
        }
        if (term instanceof Root root) {
            if (root.constraints().contains(BoolConstant.TRUE)) {
                return Optional.of(new Root(withoutConstant(root.constraints(), BoolConstant.TRUE)));
            }
        }
        return Optional.empty();
    }

    private static Optional<Expression> evaluateNot(Not not) {
        if (not.operand() instanceof BoolConstant constant) {
            return Optional.of(BoolConstant.of(!constant.value()));
        }
        if (not.operand() instanceof Not inner) {
            return Optional.of(inner.operand());
        }
        return Optional.empty();
    }

    private static Optional<Expression> evaluateAnd(And and) {
        List<Expression> operands = and.operands();
        if (operands.isEmpty()) {
            return Optional.of(BoolConstant.TRUE);
        }
        if (operands.contains(BoolConstant.FALSE)) {
            return Optional.of(BoolConstant.FALSE);
        }
        if (operands.contains(BoolConstant.TRUE)) {
            return Optional.of(new And(withoutConstant(operands, BoolConstant.TRUE)));
        }
        return Optional.empty();
    }

    private static Optional<Expression> evaluateOr(Or or) {
        List<Expression> operands = or.operands();
        if (operands.isEmpty()) {
            return Optional.of(BoolConstant.FALSE);
        }
        if (operands.contains(BoolConstant.TRUE)) {
            return Optional.of(BoolConstant.TRUE);
        }
        if (operands.contains(BoolConstant.FALSE)) {
            return Optional.of(new Or(withoutConstant(operands, BoolConstant.FALSE)));
        }
        return Optional.empty();
    }

    private static Optional<Expression> evaluateIff(Iff iff) {
        if (iff.left().equals(iff.right())) {
            return Optional.of(BoolConstant.TRUE);
        }
        if (iff.left() instanceof BoolConstant constant) {
            return Optional.of(constant.value() ? iff.right() : new Not(iff.right()));
        }
        if (iff.right() instanceof BoolConstant constant) {
            return Optional.of(constant.value() ? iff.left() : new Not(iff.left()));
        }
        return Optional.empty();
    }

    private static Optional<Boolean> evaluateEq(Expression left, Expression right) {
        if (left.equals(right)) {
            return Optional.of(true);
        }
        if (left instanceof IntConstant l && right instanceof IntConstant r) {
            return Optional.of(l.value() == r.value());
        }
        if (left instanceof BoolConstant l && right instanceof BoolConstant r) {
            return Optional.of(l.value() == r.value());
        }
        return Optional.empty();
    }

    private static Optional<Expression> evaluateSum(Sum sum) {
        List<Expression> operands = sum.operands();
        if (operands.size() == 1) {
            return Optional.of(operands.get(0));
        }
        int total = 0;
        for (Expression operand : operands) {
            if (!(operand instanceof IntConstant constant)) {
                return Optional.empty();
            }
            try {
                total = Math.addExact(total, constant.value());
            } catch (ArithmeticException e) {
                return Optional.empty();
            }
        }
        return Optional.of(new IntConstant(total));
    }

    private static List<Expression> withoutConstant(List<Expression> operands, BoolConstant constant) {
        return operands.stream().filter(e -> !e.equals(constant)).collect(Collectors.toList());
    }

    private static Optional<Integer> closedLowerBound(MatrixLiteral matrix) {
        if (matrix.index() instanceof IntDomain domain && domain.ranges().size() == 1) {
            Range range = domain.ranges().get(0);
            if (range.lower() != null && range.upper() != null) {
                return Optional.of(range.lower());
            }
        }
        return Optional.empty();
    }
}

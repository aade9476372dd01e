package com.essence.rewriter.engine;

import com.essence.rewriter.api.RewriteListener;
import com.essence.rewriter.api.exceptions.MalformedReconstructionException;
import com.essence.rewriter.api.exceptions.NonConvergenceException;
import com.essence.rewriter.api.exceptions.RuleApplicationException;
import com.essence.rewriter.api.exceptions.UnresolvedIdentifierException;
import com.essence.rewriter.api.model.CancellationToken;
import com.essence.rewriter.api.model.RewriteOptions;
import com.essence.rewriter.api.model.RewriteResult;
import com.essence.rewriter.api.model.RewriteResult.Outcome;
import com.essence.rewriter.api.model.RewriteState;
import com.essence.rewriter.api.model.SelectionStrategy;
import com.essence.rewriter.api.model.TraceEntry;
import com.essence.rewriter.ast.And;
import com.essence.rewriter.ast.BoolDomain;
import com.essence.rewriter.ast.Expression;
import com.essence.rewriter.ast.Name;
import com.essence.rewriter.ast.Not;
import com.essence.rewriter.ast.Or;
import com.essence.rewriter.ast.Reference;
import com.essence.rewriter.ast.WatchedLiteral;
import com.essence.rewriter.engine.ActiveRules.ActiveRule;
import com.essence.rewriter.engine.trace.TraceRenderer;
import com.essence.rewriter.infra.metrics.RewriterMetric;
import com.essence.rewriter.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.essence.rewriter.model.Declaration;
import com.essence.rewriter.model.Model;
import com.essence.rewriter.model.SymbolTable;
import com.essence.rewriter.rule.Reduction;
import com.essence.rewriter.rule.Rule;
import com.essence.rewriter.rule.RuleIgnoreException;
import com.essence.rewriter.rule.RuleNotApplicableException;
import com.essence.rewriter.rule.RulePruneException;
import com.essence.rewriter.rule.RuleSet;
import com.essence.rewriter.rule.RuleSetMembership;
import com.essence.rewriter.rules.base.BaseRules;
import com.essence.rewriter.rules.minion.MinionRules;
import com.essence.rewriter.rules.registry.RuleRegistry;
import com.essence.rewriter.term.Subterm;
import com.essence.rewriter.term.TermPath;
import com.essence.rewriter.term.Terms;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.List;

import static com.essence.rewriter.ast.Expressions.bool;
import static com.essence.rewriter.ast.Expressions.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RewriterTest {

    private static final List<String> MINION = List.of(MinionRules.RULE_SET);

    private Tracer tracer;
    private InMemoryMetricsRegistry metrics;
    private RuleRegistry registry;
    private Rewriter rewriter;

    @BeforeEach
    void setUp() {
        tracer = OpenTelemetry.noop().getTracer("test");
        metrics = new InMemoryMetricsRegistry();
        registry = TestModels.standardRegistry();
        rewriter = new Rewriter(registry, tracer, metrics);
    }

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("Should normalise the index domain before flattening allDiff")
        void shouldFlattenAllDiff() {
            RewriteResult result = rewriter.rewrite(TestModels.allDiffModel(), MINION);

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.steps()).isEqualTo(2);
            assertThat(result.activeRuleSets()).containsExactly("Base", "Minion");
            assertThat(result.model().constraints()).extracting(Expression::toString)
                    .containsExactly("__flat_alldiff([a, b, c])");

            List<TraceEntry> entries = result.trace().entries();
            assertThat(entries.get(0).ruleName()).isEqualTo(BaseRules.NORMALISE_MATRIX_INDEX_DOMAIN);
            assertThat(entries.get(0).ruleSets()).containsExactly(new RuleSetMembership("Base", 2000));
            assertThat(entries.get(0).path()).isEqualTo(TermPath.of(0, 0));
            assertThat(entries.get(1).ruleName()).isEqualTo(MinionRules.FLATTEN_ALL_DIFF);
            assertThat(entries.get(1).ruleSets()).containsExactly(new RuleSetMembership("Minion", 4200));
            assertThat(entries.get(1).path()).isEqualTo(TermPath.of(0));
        }

        @Test
        @DisplayName("Should render the allDiff run exactly")
        void shouldRenderAllDiffTrace() {
            RewriteResult result = rewriter.rewrite(TestModels.allDiffModel(), MINION);

            String declarations = "find a: int(1..3)\nfind b: int(1..3)\nfind c: int(1..3)\n\nsuch that\n\n";
            String expected = "Model before rewriting:\n\n"
                    + declarations + "allDiff([a, b, c;int(1..3)])\n"
                    + "\n--\n\n"
                    + "[a, b, c;int(1..3)], \n"
                    + "   ~~> normalise_matrix_index_domain ([(\"Base\", 2000)]) \n"
                    + "[a, b, c;int(1..)] \n"
                    + "\n--\n\n"
                    + "allDiff([a, b, c;int(1..)]), \n"
                    + "   ~~> flatten_all_diff ([(\"Minion\", 4200)]) \n"
                    + "__flat_alldiff([a, b, c]) \n"
                    + "\n--\n\n"
                    + "Final model:\n\n"
                    + declarations + "__flat_alldiff([a, b, c])\n";

            assertThat(TraceRenderer.render(result.trace())).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should simplify the conjunction to a single watched literal")
        void shouldSimplifyConjunction() {
            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION);

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.trace().ruleNames()).containsExactly(
                    BaseRules.PARTIAL_EVALUATOR,
                    BaseRules.PARTIAL_EVALUATOR,
                    BaseRules.PARTIAL_EVALUATOR,
                    MinionRules.LITERAL_TO_WATCHED_LITERAL,
                    BaseRules.REMOVE_UNIT_CONJUNCTION);
            assertThat(result.trace().entries()).extracting(entry -> entry.after().toString()).containsExactly(
                    "[true]",
                    "[and([(false) <-> (y)])]",
                    "[!(y)]",
                    "[WatchedLiteral(y,false)]",
                    "[WatchedLiteral(y,false)]");
            assertThat(result.trace().entries().get(3).ruleSets())
                    .containsExactly(new RuleSetMembership("Minion", 4100));
            assertThat(result.model()).hasToString(
                    "find x: bool\nfind y: bool\n\nsuch that\n\nWatchedLiteral(y,false)");
            assertThat(result.trace().finalModel()).contains(result.model().toString());
        }

        @Test
        @DisplayName("Should introduce an auxiliary variable for a nested sum")
        void shouldFlattenNestedSum() {
            RewriteResult result = rewriter.rewrite(TestModels.nestedSumModel(), MINION,
                    RewriteOptions.defaults().withExtraRuleChecks(true));

            assertThat(result.trace().ruleNames()).containsExactly(
                    MinionRules.FLATTEN_SUM_OPERAND,
                    MinionRules.SUM_EQ_TO_INEQUALITIES,
                    MinionRules.SUM_EQ_TO_INEQUALITIES);
            assertThat(result.model().constraints()).extracting(Expression::toString).containsExactly(
                    "__flat_sumleq([__0, c],7)",
                    "__flat_sumgeq([__0, c],7)",
                    "__flat_sumleq([a, b],__0)",
                    "__flat_sumgeq([a, b],__0)");
            assertThat(result.model().symbols().lookup(Name.machine(0)))
                    .hasToString("find __0: int(2..6)");

            TraceEntry first = result.trace().entries().get(0);
            assertThat(first.newTopLevel()).extracting(Expression::toString).containsExactly("(sum([a, b])) = (__0)");
            assertThat(first.newSymbols()).extracting(Declaration::toString).containsExactly("find __0: int(2..6)");
        }
    }

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Should produce identical traces for identical runs")
        void shouldBeDeterministic() {
            RewriteResult first = rewriter.rewrite(TestModels.conjunctionModel(), MINION);
            RewriteResult second = new Rewriter(TestModels.standardRegistry(), tracer, metrics)
                    .rewrite(TestModels.conjunctionModel(), MINION);

            assertThat(TraceRenderer.render(second.trace())).isEqualTo(TraceRenderer.render(first.trace()));
        }

        @Test
        @DisplayName("Should stop only when no active rule applies anywhere")
        void shouldReachTrueFixpoint() {
            RewriteResult result = rewriter.rewrite(TestModels.nestedSumModel(), MINION);
            ActiveRules active = ActiveRules.resolve(registry, MINION);

            for (Subterm<Expression> subterm : Terms.universeWithPaths((Expression) result.model().root())) {
                for (ActiveRule rule : active.rules()) {
                    if (rule.rule().requiresVariadicContext() && !subterm.inVariadicContext()) {
                        continue;
                    }
                    assertThat(rule.rule().isApplicable(subterm.term(), result.model().symbols()))
                            .as("%s on %s", rule.name(), subterm.term())
                            .isFalse();
                }
            }
        }

        @Test
        @DisplayName("Should prefer the higher-priority rule even on a later subterm")
        void shouldPreferPriorityOverPosition() {
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));
            Model model = new Model(symbols, List.of(And.of(ref("x")), new Not(new Not(ref("x")))));

            RewriteResult result = rewriter.rewrite(model, List.of(BaseRules.RULE_SET));

            assertThat(result.trace().entries().get(0).ruleName()).isEqualTo(BaseRules.PARTIAL_EVALUATOR);
            assertThat(result.trace().entries().get(0).path()).isEqualTo(TermPath.of(1));
            assertThat(result.trace().entries().get(1).ruleName()).isEqualTo(BaseRules.REMOVE_UNIT_CONJUNCTION);
            assertThat(result.model().constraints()).containsExactly(ref("x"), ref("x"));
        }

        @Test
        @DisplayName("Should rewrite the first matching subterm under NODE_FIRST")
        void shouldRewriteTopDownUnderNodeFirst() {
            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION,
                    RewriteOptions.defaults().withStrategy(SelectionStrategy.NODE_FIRST));

            assertThat(result.trace().ruleNames()).containsExactly(
                    BaseRules.FLATTEN_CONJUNCTION,
                    BaseRules.PARTIAL_EVALUATOR,
                    BaseRules.PARTIAL_EVALUATOR,
                    BaseRules.PARTIAL_EVALUATOR,
                    MinionRules.LITERAL_TO_WATCHED_LITERAL);
            assertThat(result.model().constraints()).containsExactly(new WatchedLiteral(Name.of("y"), false));
        }

        @Test
        @DisplayName("Should splice a multi-term replacement into the constraint list")
        void shouldSpliceReplacement() {
            SymbolTable symbols = new SymbolTable()
                    .declare(Declaration.find("x", BoolDomain.INSTANCE))
                    .declare(Declaration.find("y", BoolDomain.INSTANCE))
                    .declare(Declaration.find("z", BoolDomain.INSTANCE));
            Model model = new Model(symbols, List.of(ref("x"), And.of(ref("y"), ref("z"))));

            RewriteResult result = rewriter.rewrite(model, List.of(BaseRules.RULE_SET));

            assertThat(result.steps()).isEqualTo(1);
            assertThat(result.trace().entries().get(0).ruleName()).isEqualTo(BaseRules.FLATTEN_CONJUNCTION);
            assertThat(result.model().constraints()).containsExactly(ref("x"), ref("y"), ref("z"));
        }

        @Test
        @DisplayName("Should skip candidates whose transform declines")
        void shouldSkipDecliningCandidates() {
            Rule declining = Rule.builder("always_declines")
                    .condition((term, s) -> term instanceof Reference)
                    .transform((term, s) -> {
                        throw new RuleNotApplicableException("not today");
                    })
                    .ruleSet(TestModels.TEST_RULE_SET, 10_000)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(declining), tracer, metrics);

            RewriteResult result = custom.rewrite(TestModels.conjunctionModel(),
                    List.of(TestModels.TEST_RULE_SET, MinionRules.RULE_SET));

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.trace().ruleNames()).doesNotContain("always_declines").hasSize(5);
            assertThat(metrics.getCounterValue(RewriterMetric.RULE_DECLINES, "always_declines")).isPositive();
        }

        @Test
        @DisplayName("Should break equal priorities by configured rule set order")
        void shouldBreakTiesByRuleSetPrecedence() {
            Rule fromB = watchRule("from_b", false).ruleSet("B", 100).build();
            Rule fromA = watchRule("from_a", true).ruleSet("A", 100).build();
            Rewriter custom = new Rewriter(
                    TestModels.registryWith(List.of(RuleSet.of("A"), RuleSet.of("B")), fromB, fromA), tracer, metrics);

            RewriteResult aFirst = custom.rewrite(singleReferenceModel(), List.of("A", "B"));
            RewriteResult bFirst = custom.rewrite(singleReferenceModel(), List.of("B", "A"));

            assertThat(aFirst.trace().ruleNames()).containsExactly("from_a");
            assertThat(aFirst.model().constraints()).containsExactly(new WatchedLiteral(Name.of("x"), true));
            assertThat(bFirst.trace().ruleNames()).containsExactly("from_b");
            assertThat(bFirst.model().constraints()).containsExactly(new WatchedLiteral(Name.of("x"), false));
        }

        @Test
        @DisplayName("Should list every active membership of a shared rule in rule set order")
        void shouldTraceEveryMembership() {
            Rule multi = watchRule("multi", true).ruleSet("B", 100).ruleSet("A", 100).build();
            Rule lateRegistered = watchRule("late_registered", false).ruleSet("B", 100).build();
            Rewriter custom = new Rewriter(
                    TestModels.registryWith(List.of(RuleSet.of("A"), RuleSet.of("B")), multi, lateRegistered),
                    tracer, metrics);

            RewriteResult result = custom.rewrite(singleReferenceModel(), List.of("A", "B"));

            assertThat(result.steps()).isEqualTo(1);
            TraceEntry entry = result.trace().entries().get(0);
            assertThat(entry.ruleName()).isEqualTo("multi");
            assertThat(entry.ruleSets()).containsExactly(
                    new RuleSetMembership("A", 100),
                    new RuleSetMembership("B", 100));
            assertThat(TraceRenderer.renderEntry(entry)).contains("~~> multi ([(\"A\", 100), (\"B\", 100)])");
        }

        private Rule.Builder watchRule(String name, boolean value) {
            return Rule.builder(name)
                    .condition((term, s) -> term instanceof Reference)
                    .transform((term, s) -> Reduction.pure(new WatchedLiteral(((Reference) term).name(), value)));
        }

        private Model singleReferenceModel() {
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));
            return new Model(symbols, List.of(ref("x")));
        }
    }

    @Nested
    @DisplayName("Skipped subtrees")
    class Skipping {

        private final List<String> testThenBase = List.of(TestModels.TEST_RULE_SET, BaseRules.RULE_SET);

        @Test
        @DisplayName("Should skip only the disjunction when a condition ignores it at depth zero")
        void shouldIgnoreMatchedNodeOnly() {
            RewriteResult result = rewriteWith(ignoreDisjunctionsOnCondition(0));

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.trace().ruleNames())
                    .containsExactly(BaseRules.PARTIAL_EVALUATOR, BaseRules.PARTIAL_EVALUATOR);
            assertThat(result.model().constraints()).containsExactly(Or.of(bool(false)));
        }

        @Test
        @DisplayName("Should skip the disjunction and its operands when ignored at depth one")
        void shouldIgnoreDownToDepth() {
            RewriteResult result = rewriteWith(ignoreDisjunctionsOnCondition(1));

            assertThat(result.trace().entries()).singleElement()
                    .satisfies(entry -> assertThat(entry.path()).isEqualTo(TermPath.of(0, 0, 0)));
            assertThat(result.model().constraints()).containsExactly(Or.of(new Not(bool(true))));
        }

        @Test
        @DisplayName("Should skip the whole subtree when a condition prunes it")
        void shouldPruneSubtree() {
            Rule prune = Rule.builder("prune_disjunctions")
                    .condition((term, s) -> {
                        if (term instanceof Or) {
                            throw new RulePruneException("leave disjunctions alone");
                        }
                        return false;
                    })
                    .transform((term, s) -> Reduction.pure(term))
                    .ruleSet(TestModels.TEST_RULE_SET, 1)
                    .build();

            RewriteResult result = rewriteWith(prune);

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.steps()).isZero();
            assertThat(result.model()).isEqualTo(TestModels.nestedNegationModel());
        }

        @Test
        @DisplayName("Should drop candidates already found on a node a later condition ignores")
        void shouldDropEarlierCandidatesOnIgnoredNode() {
            Rule ignore = Rule.builder("ignore_negations")
                    .condition((term, s) -> {
                        if (term instanceof Not) {
                            throw new RuleIgnoreException(0, "negations stay");
                        }
                        return false;
                    })
                    .transform((term, s) -> Reduction.pure(term))
                    .ruleSet(TestModels.TEST_RULE_SET, 1)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(ignore), tracer, metrics);
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));
            Model input = new Model(symbols, List.of(new Not(new Not(ref("x")))));

            RewriteResult result = custom.rewrite(input, testThenBase);

            assertThat(result.steps()).isZero();
            assertThat(result.model()).isEqualTo(input);
        }

        @Test
        @DisplayName("Should withdraw later candidates in the region a transform ignores")
        void shouldIgnoreFromTransform() {
            Rule ignore = Rule.builder("ignore_disjunction_operands")
                    .condition((term, s) -> term instanceof Or)
                    .transform((term, s) -> {
                        throw new RuleIgnoreException(1, "operands stay");
                    })
                    .ruleSet(TestModels.TEST_RULE_SET, 10_000)
                    .build();

            RewriteResult result = rewriteWith(ignore);

            assertThat(result.trace().ruleNames()).containsExactly(BaseRules.PARTIAL_EVALUATOR);
            assertThat(result.trace().entries().get(0).path()).isEqualTo(TermPath.of(0, 0, 0));
            assertThat(result.model().constraints()).containsExactly(Or.of(new Not(bool(true))));
        }

        @Test
        @DisplayName("Should reach a fixpoint when a transform prunes the only rewritable subtree")
        void shouldPruneFromTransform() {
            Rule prune = Rule.builder("prune_disjunction")
                    .condition((term, s) -> term instanceof Or)
                    .transform((term, s) -> {
                        throw new RulePruneException("disjunction stays");
                    })
                    .ruleSet(TestModels.TEST_RULE_SET, 10_000)
                    .build();

            RewriteResult result = rewriteWith(prune);

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.steps()).isZero();
            assertThat(result.model()).isEqualTo(TestModels.nestedNegationModel());
            assertThat(metrics.getCounterValue(RewriterMetric.SKIPPED_SUBTREES, "prune_disjunction")).isEqualTo(1);
        }

        private Rule ignoreDisjunctionsOnCondition(int depth) {
            return Rule.builder("ignore_disjunctions")
                    .condition((term, s) -> {
                        if (term instanceof Or) {
                            throw new RuleIgnoreException(depth, "disjunctions stay");
                        }
                        return false;
                    })
                    .transform((term, s) -> Reduction.pure(term))
                    .ruleSet(TestModels.TEST_RULE_SET, 1)
                    .build();
        }

        private RewriteResult rewriteWith(Rule rule) {
            Rewriter custom = new Rewriter(TestModels.registryWith(rule), tracer, metrics);
            return custom.rewrite(TestModels.nestedNegationModel(), testThenBase);
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("Should report non-convergence when the cap is hit")
        void shouldReportNonConvergence() {
            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION,
                    RewriteOptions.defaults().withMaxIterations(1));

            assertThat(result.outcome()).isEqualTo(Outcome.DID_NOT_CONVERGE);
            assertThat(result.steps()).isEqualTo(1);
            assertThat(result.trace().isFinalised()).isFalse();
            assertThatThrownBy(result::orThrow)
                    .isInstanceOf(NonConvergenceException.class)
                    .satisfies(e -> {
                        NonConvergenceException error = (NonConvergenceException) e;
                        assertThat(error.getMaxIterations()).isEqualTo(1);
                        assertThat(error.getPartialTrace().ruleNames()).containsExactly(BaseRules.PARTIAL_EVALUATOR);
                    });
        }

        @Test
        @DisplayName("Should reach a fixpoint that needs exactly the capped number of steps")
        void shouldConvergeAtCap() {
            RewriteResult result = rewriter.rewrite(TestModels.allDiffModel(), MINION,
                    RewriteOptions.defaults().withMaxIterations(2));

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.orThrow()).isSameAs(result);
        }

        @Test
        @DisplayName("Should treat a cap of zero as unbounded")
        void shouldRunUnboundedWithZeroCap() {
            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION,
                    RewriteOptions.defaults().withMaxIterations(0));

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.steps()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should stop before the first step when already cancelled")
        void shouldHonourCancellation() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            Model input = TestModels.conjunctionModel();

            RewriteResult result = rewriter.rewrite(input, MINION, RewriteOptions.defaults().withCancellation(token));

            assertThat(result.outcome()).isEqualTo(Outcome.CANCELLED);
            assertThat(result.steps()).isZero();
            assertThat(result.model()).isEqualTo(input);
        }

        @Test
        @DisplayName("Should cancel between steps from a listener")
        void shouldCancelFromListener() {
            CancellationToken token = new CancellationToken();
            rewriter.setRewriteListener(new RewriteListener() {
                @Override
                public void onRuleApplied(TraceEntry entry) {
                    if (entry.step() == 2) {
                        token.cancel();
                    }
                }
            });

            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION,
                    RewriteOptions.defaults().withCancellation(token));

            assertThat(result.outcome()).isEqualTo(Outcome.CANCELLED);
            assertThat(result.steps()).isEqualTo(2);
            assertThat(result.trace().size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should reject a splice under a fixed-arity parent and keep the input untouched")
        void shouldRejectMalformedReplacement() {
            Rule duplicate = Rule.builder("duplicate_reference")
                    .condition((term, s) -> term instanceof Reference)
                    .transform((term, s) -> Reduction.splice(List.of(term, term)))
                    .ruleSet(TestModels.TEST_RULE_SET, 100)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(duplicate), tracer, metrics);
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));
            Model input = new Model(symbols, List.of(new Not(ref("x"))));
            String before = input.toString();

            assertThatThrownBy(() -> custom.rewrite(input, List.of(TestModels.TEST_RULE_SET)))
                    .isInstanceOf(MalformedReconstructionException.class)
                    .hasMessageContaining("duplicate_reference")
                    .satisfies(e -> {
                        MalformedReconstructionException error = (MalformedReconstructionException) e;
                        assertThat(error.getRuleName()).isEqualTo("duplicate_reference");
                        assertThat(error.getTerm()).isEqualTo("x");
                        assertThat(error.getStep()).isEqualTo(1);
                    });
            assertThat(input).hasToString(before);
        }

        @Test
        @DisplayName("Should wrap unexpected transform failures with rule context")
        void shouldWrapTransformFailure() {
            Rule broken = Rule.builder("broken_rule")
                    .condition((term, s) -> term instanceof Not)
                    .transform((term, s) -> {
                        throw new IllegalStateException("boom");
                    })
                    .ruleSet(TestModels.TEST_RULE_SET, 100)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(broken), tracer, metrics);
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));

            assertThatThrownBy(() -> custom.rewrite(
                    new Model(symbols, List.of(new Not(ref("x")))), List.of(TestModels.TEST_RULE_SET)))
                    .isInstanceOf(RuleApplicationException.class)
                    .hasMessageContaining("broken_rule")
                    .hasMessageContaining("boom")
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Should catch dangling references only when extra checks are on")
        void shouldValidateReferencesWithExtraChecks() {
            Rule ghost = Rule.builder("watch_ghost")
                    .condition((term, s) -> term instanceof Reference)
                    .transform((term, s) -> Reduction.pure(new WatchedLiteral(Name.of("ghost"), true)))
                    .ruleSet(TestModels.TEST_RULE_SET, 100)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(ghost), tracer, metrics);
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));
            Model input = new Model(symbols, List.of(ref("x")));
            List<String> ruleSets = List.of(TestModels.TEST_RULE_SET);

            assertThat(custom.rewrite(input, ruleSets).model().constraints())
                    .containsExactly(new WatchedLiteral(Name.of("ghost"), true));
            assertThatThrownBy(() -> custom.rewrite(input, ruleSets,
                    RewriteOptions.defaults().withExtraRuleChecks(true)))
                    .isInstanceOf(UnresolvedIdentifierException.class)
                    .hasMessageContaining("ghost")
                    .satisfies(e -> {
                        UnresolvedIdentifierException error = (UnresolvedIdentifierException) e;
                        assertThat(error.getRuleName()).isEqualTo("watch_ghost");
                        assertThat(error.getStep()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("Should name the rule, term and step when a rule meets an undeclared name")
        void shouldReportUnresolvedIdentifierWithContext() {
            Model input = new Model(new SymbolTable(), List.of(ref("ghost")));
            RewriteListener listener = mock(RewriteListener.class);
            rewriter.setRewriteListener(listener);

            assertThatThrownBy(() -> rewriter.rewrite(input, MINION))
                    .isInstanceOf(UnresolvedIdentifierException.class)
                    .hasMessageContaining(MinionRules.LITERAL_TO_WATCHED_LITERAL)
                    .satisfies(e -> {
                        UnresolvedIdentifierException error = (UnresolvedIdentifierException) e;
                        assertThat(error.getName()).isEqualTo(Name.of("ghost"));
                        assertThat(error.getRuleName()).isEqualTo(MinionRules.LITERAL_TO_WATCHED_LITERAL);
                        assertThat(error.getTerm()).isEqualTo("ghost");
                        assertThat(error.getStep()).isEqualTo(1);
                    });
            verify(listener).onError(eq(1), any(UnresolvedIdentifierException.class));
        }

        @Test
        @DisplayName("Should wrap unexpected condition failures with rule context")
        void shouldWrapConditionFailure() {
            Rule broken = Rule.builder("broken_condition")
                    .condition((term, s) -> {
                        throw new IllegalStateException("bad condition");
                    })
                    .transform((term, s) -> Reduction.pure(term))
                    .ruleSet(TestModels.TEST_RULE_SET, 100)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(broken), tracer, metrics);

            assertThatThrownBy(() -> custom.rewrite(TestModels.allDiffModel(), List.of(TestModels.TEST_RULE_SET)))
                    .isInstanceOf(RuleApplicationException.class)
                    .satisfies(e -> {
                        RuleApplicationException error = (RuleApplicationException) e;
                        assertThat(error.getRuleName()).isEqualTo("broken_condition");
                        assertThat(error.getStep()).isEqualTo(1);
                    });
        }

        @Test
        @DisplayName("Should reject unknown rule sets")
        void shouldRejectUnknownRuleSet() {
            assertThatThrownBy(() -> rewriter.rewrite(TestModels.allDiffModel(), List.of("Gecode")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Gecode");
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("Should notify the listener of every stage")
        void shouldNotifyListener() {
            RewriteListener listener = mock(RewriteListener.class);
            rewriter.setRewriteListener(listener);

            rewriter.rewrite(TestModels.conjunctionModel(), MINION);

            InOrder order = inOrder(listener);
            order.verify(listener).onRewriteStart(any(Model.class), eq(List.of("Base", "Minion")));
            order.verify(listener).onStateChange(RewriteState.SCANNING, 0);
            order.verify(listener).onStateChange(RewriteState.APPLYING, 0);
            order.verify(listener, times(5)).onRuleApplied(any(TraceEntry.class));
            order.verify(listener).onStateChange(RewriteState.FIXED, 5);
            order.verify(listener).onFixpoint(any(Model.class), eq(5));
            verify(listener, never()).onError(anyInt(), any());
        }

        @Test
        @DisplayName("Should report the failing step to the listener")
        void shouldNotifyListenerOfErrors() {
            Rule broken = Rule.builder("broken_rule")
                    .condition((term, s) -> term instanceof Not)
                    .transform((term, s) -> {
                        throw new IllegalStateException("boom");
                    })
                    .ruleSet(TestModels.TEST_RULE_SET, 100)
                    .build();
            Rewriter custom = new Rewriter(TestModels.registryWith(broken), tracer, metrics);
            RewriteListener listener = mock(RewriteListener.class);
            custom.setRewriteListener(listener);
            SymbolTable symbols = new SymbolTable().declare(Declaration.find("x", BoolDomain.INSTANCE));

            assertThatThrownBy(() -> custom.rewrite(
                    new Model(symbols, List.of(new Not(ref("x")))), List.of(TestModels.TEST_RULE_SET)))
                    .isInstanceOf(RuleApplicationException.class);

            verify(listener).onError(eq(1), any(RuleApplicationException.class));
            verify(listener, never()).onFixpoint(any(), anyInt());
        }

        @Test
        @DisplayName("Should keep running when the listener throws")
        void shouldIgnoreListenerFailures() {
            RewriteListener listener = mock(RewriteListener.class);
            doThrow(new IllegalStateException("listener bug")).when(listener).onRuleApplied(any());
            rewriter.setRewriteListener(listener);

            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION);

            assertThat(result.outcome()).isEqualTo(Outcome.FIXED);
            assertThat(result.steps()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should count steps and rule applications")
        void shouldRecordMetrics() {
            rewriter.rewrite(TestModels.conjunctionModel(), MINION);

            assertThat(metrics.getCounterValue(RewriterMetric.STEPS)).isEqualTo(5);
            assertThat(metrics.getCounterValue(RewriterMetric.RULE_APPLICATIONS, BaseRules.PARTIAL_EVALUATOR))
                    .isEqualTo(3);
            assertThat(metrics.getCounterValue(RewriterMetric.RULE_APPLICATIONS,
                    MinionRules.LITERAL_TO_WATCHED_LITERAL)).isEqualTo(1);
            assertThat(metrics.getTimerRecordings(RewriterMetric.RUN_DURATION)).hasSize(1);
        }

        @Test
        @DisplayName("Should still capture both models when step tracing is off")
        void shouldSkipEntriesWhenTracingDisabled() {
            RewriteResult result = rewriter.rewrite(TestModels.conjunctionModel(), MINION,
                    RewriteOptions.defaults().withTraceEnabled(false));

            assertThat(result.steps()).isEqualTo(5);
            assertThat(result.trace().entries()).isEmpty();
            assertThat(result.trace().initialModel()).isEqualTo(TestModels.conjunctionModel().toString());
            assertThat(result.trace().isFinalised()).isTrue();
        }
    }

    @Test
    @DisplayName("Should leave the caller's model unchanged")
    void shouldNotModifyInput() {
        Model input = TestModels.nestedSumModel();
        Model snapshot = input.copy();

        RewriteResult result = rewriter.rewrite(input, MINION);

        assertThat(input).isEqualTo(snapshot);
        assertThat(input.symbols().contains(Name.machine(0))).isFalse();
        assertThat(result.model()).isNotEqualTo(input);
    }
}

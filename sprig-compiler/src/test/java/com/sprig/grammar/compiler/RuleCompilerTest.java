package com.sprig.grammar.compiler;

import com.sprig.grammar.api.CompilationListener;
import com.sprig.grammar.api.exceptions.CompilationException;
import com.sprig.grammar.api.exceptions.CompilationException.Reason;
import com.sprig.grammar.api.exceptions.RuleNotFoundException;
import com.sprig.grammar.api.model.NodeType;
import com.sprig.grammar.infra.metrics.GrammarMetrics;
import com.sprig.grammar.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.sprig.grammar.runtime.model.FallbackNode;
import com.sprig.grammar.runtime.model.LeafNode;
import com.sprig.grammar.runtime.model.Node;
import com.sprig.grammar.runtime.model.RepetitionNode;
import com.sprig.grammar.runtime.model.RuleRegistry;
import com.sprig.grammar.runtime.model.SelectorNode;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;

import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RuleCompilerTest {

    private RuleRegistry<String> registry;
    private InMemoryMetricsRegistry metrics;
    private RuleCompiler<String> compiler;

    @BeforeEach
    void setUp() {
        registry = new RuleRegistry<>();
        metrics = new InMemoryMetricsRegistry();
        compiler = new RuleCompiler<>(registry, Function.identity(), metrics,
                OpenTelemetry.noop().getTracer("test"));
    }

    private NodeType typeOf(String name) {
        return registry.get(name).type();
    }

    private String nameAt(int slot) {
        return registry.namesResolvingTo(registry.resolve(slot)).get(0);
    }

    @Nested
    @DisplayName("Operator precedence")
    class Precedence {

        @Test
        @DisplayName("Should split a fallback at its leftmost arrow before anything else")
        void shouldPreferFallback() {
            compiler.compile("r", "a -> b & c");

            FallbackNode<String> node = (FallbackNode<String>) registry.get("r");
            assertThat(node.primary()).isEqualTo(registry.slotOf("a"));
            assertThat(node.fallback()).isEqualTo(registry.slotOf("b & c"));
            assertThat(typeOf("b & c")).isEqualTo(NodeType.SEQUENCE);
        }

        @Test
        @DisplayName("Should nest a chained fallback to the right")
        void shouldNestChainedFallback() {
            compiler.compile("r", "a -> b -> c");

            assertThat(typeOf("r")).isEqualTo(NodeType.FALLBACK);
            assertThat(typeOf("b -> c")).isEqualTo(NodeType.FALLBACK);
        }

        @Test
        @DisplayName("Should bind a sequence looser than a selector")
        void shouldPreferSequenceOverSelector() {
            compiler.compile("r", "a & 1 x | 1 y");

            Node<String> node = registry.get("r");
            assertThat(node.type()).isEqualTo(NodeType.SEQUENCE);
            assertThat(node.children().toIntArray()).hasSize(2);
            assertThat(nameAt(node.children().getInt(0))).isEqualTo("a");
            assertThat(typeOf("1 x | 1 y")).isEqualTo(NodeType.SELECTOR);
        }

        @Test
        @DisplayName("Should bind a selector looser than a repetition")
        void shouldPreferSelectorOverRepetition() {
            compiler.compile("r", "1 a # 2 | 3 b");

            SelectorNode<String> node = (SelectorNode<String>) registry.get("r");
            assertThat(node.weights().toDoubleArray()).containsExactly(1.0, 3.0);
            assertThat(nameAt(node.options().getInt(0))).isEqualTo("a # 2");
            assertThat(((RepetitionNode<String>) registry.get("a # 2")).count()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should keep sequence children in source order")
        void shouldKeepSequenceOrder() {
            compiler.compile("r", "c & a & b");

            Node<String> node = registry.get("r");
            assertThat(node.children().intStream().mapToObj(RuleCompilerTest.this::nameAt))
                    .containsExactly("c", "a", "b");
        }

        @ParameterizedTest(name = "\"{0}\" repeats {1} times")
        @CsvSource({
                "a # 3, 3",
                "a # 0, 0",
                "a # 2.9, 2",
                "a # 0.5, 0"
        })
        @DisplayName("Should truncate repetition counts toward zero")
        void shouldTruncateRepetitionCount(String text, int expected) {
            compiler.compile("r", text);

            RepetitionNode<String> node = (RepetitionNode<String>) registry.get("r");
            assertThat(node.count()).isEqualTo(expected);
            assertThat(node.child()).isEqualTo(registry.slotOf("a"));
        }

        @Test
        @DisplayName("Should trim tokens and selector references")
        void shouldTrimTokens() {
            compiler.compile("r", "2   cat | 1 dog ");

            SelectorNode<String> node = (SelectorNode<String>) registry.get("r");
            assertThat(nameAt(node.options().getInt(0))).isEqualTo("cat");
            assertThat(nameAt(node.options().getInt(1))).isEqualTo("dog");
        }
    }

    @Nested
    @DisplayName("Atomic rules")
    class Atomic {

        @Test
        @DisplayName("Should promote an unregistered token to a literal leaf")
        void shouldPromoteLiteral() {
            compiler.compile("r", "big cat");

            assertThat(registry.get("big cat")).isEqualTo(new LeafNode<>("big cat"));
            assertThat(registry.get("r")).isSameAs(registry.get("big cat"));
        }

        @Test
        @DisplayName("Should make a name compiled as itself a literal")
        void shouldCompileSelfNamedLiteral() {
            compiler.compile("cat", "cat");
            compiler.compile("cat", "cat");

            assertThat(registry.get("cat")).isEqualTo(new LeafNode<>("cat"));
            assertThat(registry.names()).containsExactly("cat");
        }

        @Test
        @DisplayName("Should let an alias follow its target's redefinition")
        void shouldFollowTarget() {
            compiler.compile("noun", "cat");
            compiler.compile("cat", "kitten");

            assertThat(registry.get("noun")).isEqualTo(new LeafNode<>("kitten"));
        }

        @Test
        @DisplayName("Should redefine an alias without touching its old target")
        void shouldRedefineAliasIndependently() {
            compiler.compile("noun", "cat");
            compiler.compile("noun", "1 dog | 1 cat");

            assertThat(typeOf("noun")).isEqualTo(NodeType.SELECTOR);
            assertThat(registry.get("cat")).isEqualTo(new LeafNode<>("cat"));
        }

        @Test
        @DisplayName("Should require registered tokens when literals are disabled")
        void shouldRequireRegisteredTokensForValues() {
            RuleRegistry<Integer> values = new RuleRegistry<>();
            RuleCompiler<Integer> valueCompiler = RuleCompiler.forValues(values);
            values.registerLeaf("one", 1);

            valueCompiler.compile("pair", "one & one");

            assertThat(values.get("pair").children().toIntArray()).containsExactly(values.slotOf("one"), values.slotOf("one"));
            assertThatThrownBy(() -> valueCompiler.compile("r", "missing"))
                    .isInstanceOf(RuleNotFoundException.class)
                    .hasMessageContaining("missing");
            assertThatThrownBy(() -> valueCompiler.compile("s", "one & two"))
                    .isInstanceOf(RuleNotFoundException.class);
            assertThat(values.names()).containsExactly("one", "pair");
        }
    }

    @Nested
    @DisplayName("Sharing and redefinition")
    class Sharing {

        @Test
        @DisplayName("Should intern identical sub-expressions")
        void shouldInternSubExpressions() {
            compiler.compile("x", "p -> 1 a | 1 b");
            compiler.compile("y", "q -> 1 a | 1 b");

            FallbackNode<String> x = (FallbackNode<String>) registry.get("x");
            FallbackNode<String> y = (FallbackNode<String>) registry.get("y");
            assertThat(x.fallback()).isEqualTo(y.fallback());
        }

        @Test
        @DisplayName("Should let a rule refer to itself through its own slot")
        void shouldResolveSelfReference() {
            compiler.compile("r", "x & r -> end");

            Node<String> primary = registry.get("x & r");
            assertThat(primary.children().getInt(1)).isEqualTo(registry.slotOf("r"));
            assertThat(typeOf("r")).isEqualTo(NodeType.FALLBACK);
        }

        @Test
        @DisplayName("Should patch a redefined rule under every existing referrer")
        void shouldPatchReferrers() {
            compiler.compile("s", "a & r & b");
            int before = registry.get("s").children().getInt(1);

            compiler.compile("r", "1 x | 1 y");

            assertThat(registry.get("s").children().getInt(1)).isEqualTo(before);
            assertThat(registry.nodeAt(before).type()).isEqualTo(NodeType.SELECTOR);
        }
    }

    @Nested
    @DisplayName("Malformed rules")
    class Malformed {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource(delimiter = ';', value = {
                "1 a | b; MALFORMED_CLAUSE",
                "x a | 1 b; INVALID_WEIGHT",
                "NaN a | 1 b; INVALID_WEIGHT",
                "Infinity a | 1 b; INVALID_WEIGHT",
                "0 a | 1 b; NON_POSITIVE_WEIGHT",
                "-2 a | 1 b; NON_POSITIVE_WEIGHT",
                "a # x; INVALID_REPETITION_COUNT",
                "a # -1; INVALID_REPETITION_COUNT",
                "a # NaN; INVALID_REPETITION_COUNT",
                "a # 1e12; INVALID_REPETITION_COUNT",
                "a &  & b; MALFORMED_CLAUSE",
                "x # 3 # 2; INVALID_REPETITION_COUNT"
        })
        @DisplayName("Should reject malformed clauses with the matching reason")
        void shouldRejectWithReason(String text, Reason reason) {
            assertThatThrownBy(() -> compiler.compile("r", text))
                    .isInstanceOf(CompilationException.class)
                    .satisfies(e -> assertThat(((CompilationException) e).reason()).isEqualTo(reason))
                    .hasMessageContaining(reason.name());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", " -> b", "a -> ", " # 3", "a # ", "a & "})
        @DisplayName("Should reject empty rules and operands")
        void shouldRejectEmptyOperands(String text) {
            assertThatThrownBy(() -> compiler.compile("r", text))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("MALFORMED_CLAUSE");
        }

        @Test
        @DisplayName("Should report the rule name and the offending clause")
        void shouldCarryContext() {
            assertThatThrownBy(() -> compiler.compile("animal", "3 cat | dog"))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("rule 'animal'")
                    .hasMessageContaining("clause: 'dog'");
        }
    }

    @Nested
    @DisplayName("Rollback")
    class Rollback {

        @Test
        @DisplayName("Should remove every name a failed compile registered")
        void shouldRemoveNewNames() {
            assertThatThrownBy(() -> compiler.compile("r", "fresh & 0 a | 1 b"))
                    .isInstanceOf(CompilationException.class);

            assertThat(registry.names()).isEmpty();
        }

        @Test
        @DisplayName("Should reuse the slots of failed compiles")
        void shouldNotGrowArenaOnRepeatedFailures() {
            compiler.compile("keep", "k & 1 x | 1 y");
            assertThatThrownBy(() -> compiler.compile("r", "fresh & 0 a | 1 b"))
                    .isInstanceOf(CompilationException.class);
            int slotsAfterFirstFailure = registry.slotCount();

            for (int i = 0; i < 50; i++) {
                assertThatThrownBy(() -> compiler.compile("r", "fresh & 0 a | 1 b"))
                        .isInstanceOf(CompilationException.class);
            }

            assertThat(registry.slotCount()).isEqualTo(slotsAfterFirstFailure);
            assertThat(registry.names()).containsExactly("keep", "k", "1 x | 1 y", "x", "y");

            compiler.compile("r", "fresh & keep");
            assertThat(registry.slotCount()).isEqualTo(slotsAfterFirstFailure);
            assertThat(registry.get("r").type()).isEqualTo(NodeType.SEQUENCE);
        }

        @Test
        @DisplayName("Should keep the previous definition when a redefinition fails")
        void shouldKeepPreviousDefinition() {
            compiler.compile("r", "a & b");
            Node<String> previous = registry.get("r");

            assertThatThrownBy(() -> compiler.compile("r", "c & 1 x | y"))
                    .isInstanceOf(CompilationException.class);

            assertThat(registry.get("r")).isSameAs(previous);
            assertThat(registry.names()).containsExactly("r", "a", "b");
        }

        @Test
        @DisplayName("Should count errors and notify the listener after rolling back")
        void shouldReportFailure() {
            CompilationListener listener = mock(CompilationListener.class);
            compiler.setCompilationListener(listener);

            assertThatThrownBy(() -> compiler.compile("r", "a # many"))
                    .isInstanceOf(CompilationException.class);

            verify(listener).onError(eq("r"), any(CompilationException.class));
            assertThat(metrics.getCounterValue(GrammarMetrics.COMPILE_ERRORS)).isEqualTo(1L);
            assertThat(metrics.getGaugeValue(GrammarMetrics.REGISTERED_RULES)).isZero();
        }
    }

    @Test
    @DisplayName("Should report every installed rule to the listener, subrules first")
    void shouldNotifyListener() {
        CompilationListener listener = mock(CompilationListener.class);
        compiler.setCompilationListener(listener);

        compiler.compile("s", "a & b");
        compiler.compile("a", "z");

        InOrder order = inOrder(listener);
        order.verify(listener).onRuleCompiled("a", NodeType.LEAF, false);
        order.verify(listener).onRuleCompiled("b", NodeType.LEAF, false);
        order.verify(listener).onRuleCompiled("s", NodeType.SEQUENCE, false);
        order.verify(listener).onRuleCompiled("z", NodeType.LEAF, false);
        order.verify(listener).onRuleCompiled("a", NodeType.LEAF, true);
    }

    @Test
    @DisplayName("Should count compiled rules and track the registry size")
    void shouldRecordMetrics() {
        compiler.compile("s", "a & b");

        assertThat(metrics.getCounterValue(GrammarMetrics.RULES_COMPILED)).isEqualTo(3L);
        assertThat(metrics.getGaugeValue(GrammarMetrics.REGISTERED_RULES)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should compile an unregistered operand on demand")
    void shouldResolveOrCompile() {
        int slot = compiler.resolveOrCompile("1 a | 1 b");

        assertThat(slot).isEqualTo(registry.slotOf("1 a | 1 b"));
        assertThat(compiler.resolveOrCompile("1 a | 1 b")).isEqualTo(slot);
        assertThat(registry.names()).containsExactly("1 a | 1 b", "a", "b");
    }
}

package com.sprig.grammar.runtime.evaluation;

import com.sprig.grammar.api.exceptions.RuleNotFoundException;
import com.sprig.grammar.infra.config.GrammarConfig;
import com.sprig.grammar.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import com.sprig.grammar.runtime.model.LeafNode;
import com.sprig.grammar.runtime.model.RuleRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GenerationEngineTracingTest {

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private RuleRegistry<String> registry;
    private GenerationEngine<String> engine;

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);

        registry = new RuleRegistry<>();
        engine = new GenerationEngine<>(registry, GrammarConfig.defaults(), new InMemoryMetricsRegistry(), tracer);
    }

    @Test
    void shouldTraceGeneration() {
        registry.put("hello", new LeafNode<>("hello"));

        engine.generateSequence("hello");

        verify(tracer).spanBuilder("generate-sequence");
        verify(span).setAttribute("ruleName", "hello");
        verify(span).setAttribute("outputSize", 1L);
        verify(span).setAttribute("fallbackDiversions", 0L);
        verify(span).end();
    }

    @Test
    void shouldRecordMissingRule() {
        assertThatThrownBy(() -> engine.generateSequence("missing"))
                .isInstanceOf(RuleNotFoundException.class);

        verify(span).recordException(any(RuleNotFoundException.class));
        verify(span).end();
    }
}

package com.sprig.grammar.compiler;

import com.sprig.grammar.api.exceptions.CompilationException;
import com.sprig.grammar.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
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

import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleCompilerTracingTest {

    @Mock
    private Tracer tracer;

    @Mock
    private SpanBuilder spanBuilder;

    @Mock
    private Span span;

    @Mock
    private Scope scope;

    private RuleCompiler<String> compiler;

    @BeforeEach
    void setUp() {
        when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
        when(spanBuilder.startSpan()).thenReturn(span);
        when(span.makeCurrent()).thenReturn(scope);

        compiler = new RuleCompiler<>(new RuleRegistry<>(), Function.identity(),
                new InMemoryMetricsRegistry(), tracer);
    }

    @Test
    void shouldTraceSuccessfulCompile() {
        compiler.compile("greeting", "hello & world");

        verify(tracer).spanBuilder("compile-rule");
        verify(span).setAttribute("ruleName", "greeting");
        verify(span).setAttribute("nodeType", "SEQUENCE");
        verify(span).setAttribute("rulesAdded", 3L);
        verify(span, never()).recordException(any());
        verify(span).end();
        verify(scope).close();
    }

    @Test
    void shouldRecordExceptionOnFailure() {
        assertThatThrownBy(() -> compiler.compile("bad", "0 a | 1 b"))
                .isInstanceOf(CompilationException.class);

        verify(span).recordException(any(CompilationException.class));
        verify(span).end();
    }
}

/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for compiling rule text into a grammar's node graph.
 *
 * <p>Rule text uses four space-delimited operators, checked in this order:
 * <ol>
 *   <li>{@code A -> B} fallback</li>
 *   <li>{@code A & B & C} sequence</li>
 *   <li>{@code w1 A | w2 B} weighted selector</li>
 *   <li>{@code A # n} repetition</li>
 * </ol>
 * Text with none of them is an atomic reference (or a literal for string
 * grammars).
 */
public interface IGrammarCompiler {

    /**
     * Compiles {@code ruleText} and installs it under {@code ruleName}.
     * An existing rule of that name is redefined in place, so every rule that
     * already references it observes the new definition.
     *
     * @param ruleName name to install the rule under
     * @param ruleText rule text
     * @throws com.sprig.grammar.api.exceptions.CompilationException if the text is malformed
     * @throws com.sprig.grammar.api.exceptions.RuleNotFoundException if a referenced rule
     *         cannot be resolved
     */
    void compile(String ruleName, String ruleText);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}

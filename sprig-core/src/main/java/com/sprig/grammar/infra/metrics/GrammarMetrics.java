/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.metrics;

/**
 * Metric names shared by the compiler and the generation engine.
 */
public final class GrammarMetrics {

    public static final String RULES_COMPILED = "grammar_rules_compiled";
    public static final String COMPILE_ERRORS = "grammar_compile_errors";
    public static final String REGISTERED_RULES = "grammar_registered_rules";
    public static final String SEQUENCES_GENERATED = "grammar_sequences_generated";
    public static final String FALLBACK_DIVERSIONS = "grammar_fallback_diversions";
    public static final String GENERATION_TIME = "grammar_generation";

    private GrammarMetrics() {
        throw new AssertionError("No instances");
    }
}

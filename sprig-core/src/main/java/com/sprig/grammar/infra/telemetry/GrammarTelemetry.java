/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.infra.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

/**
 * Tracer lookup for the grammar engine.
 *
 * <p>The library never configures an OpenTelemetry SDK or touches the global
 * instance. Hosts that want spans pass their own tracer to the constructors or
 * to {@code setTracer}; everyone else gets the no-op tracer.
 */
public final class GrammarTelemetry {

    public static final String INSTRUMENTATION_NAME = "com.sprig.grammar";

    private GrammarTelemetry() {
        throw new AssertionError("No instances");
    }

    /**
     * Tracer that records nothing.
     */
    public static Tracer noopTracer() {
        return OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME);
    }
}

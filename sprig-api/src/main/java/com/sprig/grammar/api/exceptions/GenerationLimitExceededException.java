/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api.exceptions;

/**
 * Thrown when a generated sequence grows past the configured output cap, or
 * when the work still pending grows past the bound derived from it.
 */
public class GenerationLimitExceededException extends GrammarException {

    private final String ruleName;
    private final int limit;

    public GenerationLimitExceededException(String ruleName, int limit) {
        super("Generation of rule '" + ruleName + "' exceeded the output limit of " + limit + " values");
        this.ruleName = ruleName;
        this.limit = limit;
    }

    public GenerationLimitExceededException(String ruleName, int limit, String message) {
        super(message);
        this.ruleName = ruleName;
        this.limit = limit;
    }

    public String ruleName() {
        return ruleName;
    }

    public int limit() {
        return limit;
    }
}

/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api.exceptions;

/**
 * Thrown when a rule name is looked up but nothing is registered under it.
 *
 * <p>Raised at generation time for unknown entry points and at compile time
 * when an atomic rule references an unregistered name in a grammar whose
 * payloads cannot be promoted from literal text.
 */
public class RuleNotFoundException extends GrammarException {

    private final String ruleName;

    public RuleNotFoundException(String ruleName) {
        super("Rule not found: '" + ruleName + "'");
        this.ruleName = ruleName;
    }

    public String ruleName() {
        return ruleName;
    }
}

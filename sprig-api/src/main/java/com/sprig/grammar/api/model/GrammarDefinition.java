/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One named rule as it appears in a grammar definition document.
 *
 * <pre>{@code
 * [
 *   {"name": "greeting", "rule": "1 hello | 1 hi"},
 *   {"name": "sentence", "rule": "greeting & world"}
 * ]
 * }</pre>
 *
 * @param name rule name
 * @param rule rule text in the grammar mini-language
 * @param description optional free text, ignored by the compiler
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GrammarDefinition(
        @JsonProperty("name") String name,
        @JsonProperty("rule") String rule,
        @JsonProperty("description") String description
) {
    @JsonCreator
    public GrammarDefinition {
    }

    public GrammarDefinition(String name, String rule) {
        this(name, rule, null);
    }
}

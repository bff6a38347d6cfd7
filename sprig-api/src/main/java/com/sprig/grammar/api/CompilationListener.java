/*
 * Copyright (c) 2025 Sprig Grammar Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.sprig.grammar.api;

import com.sprig.grammar.api.model.NodeType;

/**
 * Callback interface for rule compilation events.
 *
 * <p>Every rule installed in the registry is reported, including subrules the
 * compiler declares on its own when it meets an unregistered token.
 *
 * <h2>Usage</h2>
 * <pre>
 * grammar.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onRuleCompiled(String ruleName, NodeType type, boolean redefinition) {
 *         System.out.printf("%s -> %s%s%n", ruleName, type, redefinition ? " (redefined)" : "");
 *     }
 *
 *     {@literal @}Override
 *     public void onError(String ruleName, Exception error) {
 *         System.err.printf("Rule %s failed: %s%n", ruleName, error.getMessage());
 *     }
 * });
 * </pre>
 */
public interface CompilationListener {

    /**
     * Called after a rule has been installed.
     *
     * @param ruleName     name the rule is registered under
     * @param type         variant of the node the name now resolves to
     * @param redefinition true if the name existed before this compilation
     */
    void onRuleCompiled(String ruleName, NodeType type, boolean redefinition);

    /**
     * Called when a top-level compilation fails, after the registry has been
     * rolled back.
     *
     * @param ruleName the rule whose compilation failed
     * @param error    the failure
     */
    default void onError(String ruleName, Exception error) {
    }
}

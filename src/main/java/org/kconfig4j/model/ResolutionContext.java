package org.kconfig4j.model;

import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.model.expr.Expr;

/**
 * Engine-wide state that symbol and choice value computations consult.
 * Decouples the model from the concrete {@code Kconfig} engine.
 */
public interface ResolutionContext {

    /**
     * @return The symbol whose value enables {@code m} (normally {@code MODULES}).
     */
    Symbol getModules();

    /**
     * @return The {@code option defconfig_list} symbol, or {@code null}.
     */
    Symbol getDefconfigList();

    /**
     * @return The shared expression leaf of the constant {@code n}.
     */
    Expr n();

    /**
     * @return The shared expression leaf of the constant {@code y}.
     */
    Expr y();

    String getConfigPrefix();

    DiagnosticsEngine getDiagnostics();

    /**
     * @return Whether assigning a prompt-less symbol should warn. Off while loading configuration files.
     */
    boolean isWarnAssignNoPrompt();

    /**
     * Drops every cached value. Called when the modules symbol changes.
     */
    void invalidateAll();
}

package org.kconfig4j.frontend.preprocessor;

import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.host.HostCapabilities;

import java.util.Map;

/**
 * Gives macro functions access to the preprocessor state.
 * This interface decouples functions from the concrete {@link PreProcessor}.
 */
public interface PreProcessorContext {

    /**
     * @return The file and line currently being parsed, or {@code null} outside of parsing.
     */
    SourceLocation getLocation();

    DiagnosticsEngine getDiagnostics();

    HostCapabilities getHost();

    /**
     * @return All variables defined so far, by name.
     */
    Map<String, Variable> getVariables();
}

package org.kconfig4j.diagnostics;

/**
 * Severity of a {@link Diagnostic}.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR
}

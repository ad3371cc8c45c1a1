package org.kconfig4j.diagnostics;

/**
 * A single entry on the warnings channel.
 *
 * @param severity The severity.
 * @param kind     The category, used for filtering.
 * @param message  The human-readable message, without location prefix.
 * @param location Where the problem was found, or {@code null} if not tied to a file.
 */
public record Diagnostic(Severity severity, DiagnosticKind kind, String message, SourceLocation location) {

    /**
     * Renders the diagnostic the way the C tools print it, e.g.
     * {@code Kconfig:12: warning: FOO defined with multiple types}.
     *
     * @return The formatted line.
     */
    public String format() {
        String text = severity.name().toLowerCase() + ": " + message;
        return location != null ? location + ": " + text : text;
    }

    @Override
    public String toString() {
        return format();
    }
}

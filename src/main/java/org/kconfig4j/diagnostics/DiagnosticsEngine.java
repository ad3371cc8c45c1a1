package org.kconfig4j.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects non-fatal diagnostics produced while parsing, resolving and applying configurations.
 * Fatal problems are thrown as {@link KconfigException}s instead.
 * <p>
 * Warnings can be switched off as a whole; errors (e.g. rejected out-of-range values) are always kept.
 */
public class DiagnosticsEngine {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private boolean warningsEnabled = true;
    private boolean logDiagnostics = true;

    public void reportWarning(DiagnosticKind kind, String message, SourceLocation location) {
        if (!warningsEnabled) {
            return;
        }
        add(new Diagnostic(Severity.WARNING, kind, message, location));
    }

    public void reportWarning(DiagnosticKind kind, String message) {
        reportWarning(kind, message, null);
    }

    public void reportError(DiagnosticKind kind, String message, SourceLocation location) {
        add(new Diagnostic(Severity.ERROR, kind, message, location));
    }

    public void reportInfo(String message, SourceLocation location) {
        Diagnostic diagnostic = new Diagnostic(Severity.INFO, DiagnosticKind.GENERAL, message, location);
        if (logDiagnostics) {
            log.info(location != null ? location + ": " + message : message);
        }
        diagnostics.add(diagnostic);
    }

    private void add(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        if (logDiagnostics) {
            if (diagnostic.severity() == Severity.ERROR) {
                log.error(diagnostic.format());
            } else {
                log.warn(diagnostic.format());
            }
        }
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return The formatted warnings and errors, in report order. Info messages are left out.
     */
    public List<String> warnings() {
        return diagnostics.stream()
                .filter(d -> d.severity() != Severity.INFO)
                .map(Diagnostic::format)
                .collect(Collectors.toList());
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.WARNING);
    }

    public void clear() {
        diagnostics.clear();
    }

    public boolean isWarningsEnabled() {
        return warningsEnabled;
    }

    public void setWarningsEnabled(boolean warningsEnabled) {
        this.warningsEnabled = warningsEnabled;
    }

    public boolean isLogDiagnostics() {
        return logDiagnostics;
    }

    public void setLogDiagnostics(boolean logDiagnostics) {
        this.logDiagnostics = logDiagnostics;
    }

    /**
     * @return A multi-line summary of all warnings and errors.
     */
    public String summary() {
        return String.join("\n", warnings());
    }
}

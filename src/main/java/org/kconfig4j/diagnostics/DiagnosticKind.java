package org.kconfig4j.diagnostics;

/**
 * Classifies diagnostics so hosts can filter the warnings channel.
 */
public enum DiagnosticKind {
    /** Malformed statement, expression or literal that was tolerated. */
    SYNTAX,
    /** Reference to an undefined symbol. */
    REFERENCE,
    /** Problem with a {@code source} statement. */
    INCLUSION,
    /** Assigned value outside the active numeric range. */
    RANGE,
    /** An external probe command failed or could not run. */
    PROBE_FAILURE,
    /** A host-supplied function hook raised an unexpected fault. */
    HOOK_FAULT,
    /** Problem with a value assignment (invalid, redundant, overridden, undefined target). */
    ASSIGNMENT,
    /** Style issue, e.g. missing quotes. */
    STYLE,
    /** Anything else. */
    GENERAL
}

package org.kconfig4j.model;

import org.kconfig4j.diagnostics.SourceLocation;

import java.util.List;

/**
 * Where a symbol's current value comes from.
 */
public sealed interface ValueOrigin {

    /**
     * A user assignment.
     *
     * @param label Free-form label given with the assignment, e.g. {@code .config:12}, or {@code null}.
     */
    record Assign(String label) implements ValueOrigin {}

    /**
     * A {@code default} property.
     *
     * @param location Where the default was written, or {@code null} if not known.
     */
    record Default(SourceLocation location) implements ValueOrigin {}

    /**
     * Forced by {@code select}.
     */
    record Select(List<Symbol> selectors) implements ValueOrigin {}

    /**
     * Raised by {@code imply}.
     */
    record Imply(List<Symbol> impliers) implements ValueOrigin {}

    /**
     * No source: the value is the type's empty value.
     */
    record Unset() implements ValueOrigin {}

    ValueOrigin UNSET = new Unset();
}

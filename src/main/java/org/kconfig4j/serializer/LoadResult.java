package org.kconfig4j.serializer;

import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.model.AssignmentResult;

import java.util.List;

/**
 * Outcome of loading a configuration file.
 *
 * @param message        E.g. {@code Loaded configuration '.config'}.
 * @param assignments    Every assignment line, in file order.
 * @param missingSymbols Assignments to symbols the Kconfig files do not define.
 */
public record LoadResult(String message, List<Assignment> assignments, List<MissingSymbol> missingSymbols) {

    /**
     * One applied line. {@code value} is the value as assigned: the first character for bool and
     * tristate symbols, unescaped for strings.
     */
    public record Assignment(String name, String value, AssignmentResult result, SourceLocation location) {}

    public record MissingSymbol(String name, String value) {}

    static LoadResult withoutFile(String message) {
        return new LoadResult(message, List.of(), List.of());
    }
}

package org.kconfig4j.diagnostics;

/**
 * A statement, expression or literal violates the grammar.
 */
public class KconfigSyntaxException extends KconfigException {

    public KconfigSyntaxException(String message) {
        super(message);
    }

    public KconfigSyntaxException(SourceLocation location, String message) {
        super(location != null ? location + ": error: " + message : "error: " + message);
    }
}

package org.kconfig4j.diagnostics;

/**
 * Thrown after parsing when symbols depend on each other in a cycle.
 */
public class DependencyLoopException extends KconfigException {

    public DependencyLoopException(String message) {
        super(message);
    }
}

package org.kconfig4j.diagnostics;

/**
 * A required {@code source} pattern matched nothing, a sourced file could not be read, or the
 * inclusion chain loops back on itself.
 */
public class KconfigInclusionException extends KconfigException {

    public KconfigInclusionException(String message) {
        super(message);
    }

    public KconfigInclusionException(String message, Throwable cause) {
        super(message, cause);
    }
}

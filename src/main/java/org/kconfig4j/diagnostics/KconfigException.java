package org.kconfig4j.diagnostics;

/**
 * Base class of all fatal engine errors. Parsing aborts when one is thrown.
 */
public class KconfigException extends RuntimeException {

    public KconfigException(String message) {
        super(message);
    }

    public KconfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

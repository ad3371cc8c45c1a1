package org.kconfig4j.diagnostics;

/**
 * An undefined symbol or variable was referenced while references are configured to be fatal.
 */
public class KconfigReferenceException extends KconfigException {

    public KconfigReferenceException(String message) {
        super(message);
    }
}

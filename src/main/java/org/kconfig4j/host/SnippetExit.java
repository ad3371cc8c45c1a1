package org.kconfig4j.host;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

/**
 * Thrown by a {@link SnippetEvaluator} when the evaluated code requests an explicit exit.
 * A status of {@code null}, {@code 0}, {@code ""}, {@code false} or an empty collection or array
 * counts as success.
 */
public class SnippetExit extends RuntimeException {

    private final transient Object status;

    public SnippetExit(Object status) {
        super("exit(" + status + ")");
        this.status = status;
    }

    public Object getStatus() {
        return status;
    }

    public boolean isSuccess() {
        if (status == null) {
            return true;
        }
        if (status instanceof Number number) {
            return number.longValue() == 0;
        }
        if (status instanceof Boolean flag) {
            return !flag;
        }
        if (status instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (status instanceof Collection<?> items) {
            return items.isEmpty();
        }
        if (status instanceof Map<?, ?> entries) {
            return entries.isEmpty();
        }
        if (status.getClass().isArray()) {
            return Array.getLength(status) == 0;
        }
        return false;
    }
}

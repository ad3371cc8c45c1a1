package org.kconfig4j.host;

import java.util.Map;

/**
 * Evaluates a code snippet in an embedded interpreter, for the {@code python}-style macro function.
 * <p>
 * Implementations signal the snippet's outcome through exceptions:
 * <ul>
 *   <li>normal return: success ({@code y})</li>
 *   <li>{@link SnippetExit}: success if its status is falsy, silent failure otherwise</li>
 *   <li>{@link AssertionError}: silent failure</li>
 *   <li>any other exception: failure reported as a warning with the exception type and message</li>
 * </ul>
 */
@FunctionalInterface
public interface SnippetEvaluator {

    /**
     * @param code  The snippet source, with macros already expanded.
     * @param scope A fresh, empty variable scope for this call.
     * @throws Exception To signal failure as described above.
     */
    void evaluate(String code, Map<String, Object> scope) throws Exception;
}

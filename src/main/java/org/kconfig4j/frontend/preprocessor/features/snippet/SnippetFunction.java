package org.kconfig4j.frontend.preprocessor.features.snippet;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;
import org.kconfig4j.host.SnippetEvaluator;
import org.kconfig4j.host.SnippetExit;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a code snippet through a host-supplied {@link SnippetEvaluator}: {@code y} on success,
 * {@code n} on failure. Every call gets a new, empty scope.
 */
public class SnippetFunction implements IMacroFunction {

    private final SnippetEvaluator evaluator;

    public SnippetFunction(SnippetEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        Map<String, Object> scope = new HashMap<>();
        try {
            evaluator.evaluate(args.get(0), scope);
            return "y";
        } catch (SnippetExit e) {
            return e.isSuccess() ? "y" : "n";
        } catch (AssertionError e) {
            return "n";
        } catch (Exception | Error e) {
            context.getDiagnostics().reportWarning(DiagnosticKind.HOOK_FAULT,
                    "snippet raised " + e.getClass().getSimpleName() + ": " + e.getMessage(), context.getLocation());
            return "n";
        }
    }
}

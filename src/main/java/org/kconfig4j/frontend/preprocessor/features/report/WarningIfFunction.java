package org.kconfig4j.frontend.preprocessor.features.report;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(warning-if,cond,msg)}: warns at the current location when {@code cond} is {@code y}.
 */
public class WarningIfFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        if (args.get(0).equals("y")) {
            context.getDiagnostics().reportWarning(DiagnosticKind.GENERAL, args.get(1), context.getLocation());
        }
        return "";
    }
}

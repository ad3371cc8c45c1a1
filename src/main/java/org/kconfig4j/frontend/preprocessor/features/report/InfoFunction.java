package org.kconfig4j.frontend.preprocessor.features.report;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(info,msg)}: prints {@code msg} prefixed with the current location. Expands to nothing.
 */
public class InfoFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        context.getDiagnostics().reportInfo(args.get(0), context.getLocation());
        return "";
    }
}

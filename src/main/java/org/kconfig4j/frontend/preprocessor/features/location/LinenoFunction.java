package org.kconfig4j.frontend.preprocessor.features.location;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(lineno)}: the line being parsed.
 */
public class LinenoFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        return context.getLocation() != null ? String.valueOf(context.getLocation().line()) : "";
    }
}

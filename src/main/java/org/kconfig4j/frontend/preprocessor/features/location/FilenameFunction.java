package org.kconfig4j.frontend.preprocessor.features.location;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(filename)}: the file being parsed.
 */
public class FilenameFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        return context.getLocation() != null ? context.getLocation().fileName() : "";
    }
}

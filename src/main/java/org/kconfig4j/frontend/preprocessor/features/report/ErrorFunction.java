package org.kconfig4j.frontend.preprocessor.features.report;

import org.kconfig4j.diagnostics.KconfigException;
import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(error,msg)}: always aborts parsing.
 */
public class ErrorFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        throw fatal(context, args.get(0));
    }

    static KconfigException fatal(PreProcessorContext context, String message) {
        return new KconfigException(context.getLocation() != null ? context.getLocation() + ": " + message : message);
    }
}

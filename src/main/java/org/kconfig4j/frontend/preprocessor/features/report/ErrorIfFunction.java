package org.kconfig4j.frontend.preprocessor.features.report;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(error-if,cond,msg)}: aborts parsing with {@code msg} when {@code cond} is {@code y}.
 */
public class ErrorIfFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        if (args.get(0).equals("y")) {
            throw ErrorFunction.fatal(context, args.get(1));
        }
        return "";
    }
}

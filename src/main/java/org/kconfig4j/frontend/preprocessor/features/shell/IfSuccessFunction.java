package org.kconfig4j.frontend.preprocessor.features.shell;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(if-success,command,then,else)}.
 */
public class IfSuccessFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        return ShellCommands.run(context, args.get(0)).succeeded() ? args.get(1) : args.get(2);
    }
}

package org.kconfig4j.frontend.preprocessor.features.shell;

import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;

import java.util.List;

/**
 * {@code $(success,command)} and {@code $(failure,command)}: {@code y} or {@code n} depending on
 * the command's exit status.
 */
public class ExitStatusFunction implements IMacroFunction {

    private final boolean expectSuccess;

    /**
     * @param expectSuccess {@code true} for {@code success}, {@code false} for {@code failure}.
     */
    public ExitStatusFunction(boolean expectSuccess) {
        this.expectSuccess = expectSuccess;
    }

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        boolean succeeded = ShellCommands.run(context, args.get(0)).succeeded();
        return succeeded == expectSuccess ? "y" : "n";
    }
}

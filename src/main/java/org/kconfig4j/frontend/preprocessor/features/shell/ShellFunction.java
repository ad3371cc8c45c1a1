package org.kconfig4j.frontend.preprocessor.features.shell;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.frontend.preprocessor.IMacroFunction;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;
import org.kconfig4j.host.CommandResult;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code $(shell,command)}: the command's standard output with trailing newlines removed and the
 * remaining newlines turned into spaces. Output on standard error becomes a warning.
 */
public class ShellFunction implements IMacroFunction {

    @Override
    public String invoke(PreProcessorContext context, List<String> args) {
        String command = args.get(0);
        CommandResult result = ShellCommands.run(context, command);
        if (result.exitCode() >= 0 && !result.stderr().isEmpty()) {
            context.getDiagnostics().reportWarning(DiagnosticKind.GENERAL,
                    "'" + command + "' wrote to stderr: " + joinLines(result.stderr()), context.getLocation());
        }
        String out = joinLines(result.stdout());
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == '\n') {
            end--;
        }
        return out.substring(0, end).replace('\n', ' ');
    }

    private static String joinLines(String text) {
        return text.lines().collect(Collectors.joining("\n"));
    }
}

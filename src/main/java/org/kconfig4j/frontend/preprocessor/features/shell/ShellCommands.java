package org.kconfig4j.frontend.preprocessor.features.shell;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;
import org.kconfig4j.host.CommandResult;
import org.kconfig4j.host.HostCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs commands through {@code sh -c} with the host's command runner.
 */
public final class ShellCommands {

    private static final Logger log = LoggerFactory.getLogger(ShellCommands.class);

    private ShellCommands() {}

    /**
     * Runs {@code command}. A command that cannot be started or times out is reported as a probe
     * failure and yields a failed result.
     */
    public static CommandResult run(PreProcessorContext context, String command) {
        HostCapabilities host = context.getHost();
        log.debug("Running '{}'", command);
        CommandResult result = host.commandRunner().run(List.of("sh", "-c", command), null, host.commandTimeout());
        if (result.exitCode() < 0) {
            context.getDiagnostics().reportWarning(DiagnosticKind.PROBE_FAILURE,
                    "'" + command + "' could not be run: " + result.stderr(), context.getLocation());
        }
        return result;
    }
}

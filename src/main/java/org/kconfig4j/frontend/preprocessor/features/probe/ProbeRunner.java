package org.kconfig4j.frontend.preprocessor.features.probe;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.frontend.preprocessor.PreProcessorContext;
import org.kconfig4j.host.CommandResult;
import org.kconfig4j.host.HostCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Runs a {@link ToolchainProbe} in a scratch directory that is removed afterwards.
 */
final class ProbeRunner {

    private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

    private ProbeRunner() {}

    static boolean succeeds(PreProcessorContext context, ToolchainProbe probe, List<String> flags, String argument) {
        Path scratch;
        try {
            scratch = Files.createTempDirectory("kconfig4j-probe");
        } catch (IOException e) {
            context.getDiagnostics().reportWarning(DiagnosticKind.PROBE_FAILURE,
                    probe.functionName() + ": cannot create a scratch directory: " + e.getMessage(), context.getLocation());
            return false;
        }
        try {
            List<String> argv = new ArrayList<>(probe.tool(context));
            argv.addAll(probe.arguments(flags, scratch));
            HostCapabilities host = context.getHost();
            CommandResult result = host.commandRunner().run(argv, probe.stdin(argument), host.commandTimeout());
            if (result.exitCode() < 0) {
                context.getDiagnostics().reportWarning(DiagnosticKind.PROBE_FAILURE,
                        probe.functionName() + ": '" + String.join(" ", argv) + "' could not be run: " + result.stderr(),
                        context.getLocation());
            }
            log.debug("{} {} -> exit {}", probe.functionName(), flags, result.exitCode());
            return result.succeeded();
        } finally {
            deleteRecursively(scratch);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
        } catch (IOException e) {
            log.debug("Could not remove {}: {}", dir, e.getMessage());
        }
    }
}

package org.kconfig4j.frontend.preprocessor.features.probe;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.frontend.preprocessor.MacroFunctionRegistry;
import org.kconfig4j.frontend.preprocessor.PreProcessor;
import org.kconfig4j.host.CommandResult;
import org.kconfig4j.host.CommandRunner;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Checks the argv each toolchain probe hands to the command runner, and the sentinel it returns.
 */
@ExtendWith(MockitoExtension.class)
public class ToolchainProbeFunctionTest {

    private DiagnosticsEngine diagnostics;
    private MapEnvironment env;
    @Mock
    private CommandRunner runner;
    private PreProcessor preProcessor;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        diagnostics.setLogDiagnostics(false);
        env = new MapEnvironment();
        preProcessor = new PreProcessor(diagnostics,
                HostCapabilities.system().withEnvironment(env).withCommandRunner(runner),
                MacroFunctionRegistry.initialize(), false);
        preProcessor.setLocation(new SourceLocation("Kconfig", 1), null);
    }

    private String expand(String text) {
        return preProcessor.expandWhole(text, List.of());
    }

    @SuppressWarnings("unchecked")
    private List<String> lastArgv() {
        ArgumentCaptor<List<String>> argv = ArgumentCaptor.forClass(List.class);
        verify(runner).run(argv.capture(), any(), any(Duration.class));
        return argv.getValue();
    }

    @Test
    @Tag("unit")
    void ccOptionRunsTheCompilerFromTheEnvironment() {
        env.with("CC", "ccache gcc");
        when(runner.run(anyList(), any(), any(Duration.class))).thenReturn(new CommandResult(0, "", ""));

        assertThat(expand("$(cc-option,-fno-pie -m64)")).isEqualTo("y");

        List<String> argv = lastArgv();
        assertThat(argv).startsWith("ccache", "gcc", "-Werror", "-fno-pie", "-m64", "-c", "-x", "c", "/dev/null");
    }

    @Test
    @Tag("unit")
    void rejectedFlagGivesN() {
        when(runner.run(anyList(), any(), any(Duration.class))).thenReturn(new CommandResult(1, "", "unknown"));

        assertThat(expand("$(ld-option,--no-such-flag)")).isEqualTo("n");
        assertThat(lastArgv()).containsExactly("ld", "-v", "--no-such-flag");
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    @Tag("unit")
    void asInstrFeedsTheInstructionOnStandardInput() {
        when(runner.run(anyList(), eq("nop\nret\n"), any(Duration.class))).thenReturn(new CommandResult(0, "", ""));

        assertThat(expand("$(as-instr,nop\\nret)")).isEqualTo("y");
    }

    @Test
    @Tag("unit")
    void ccOptionBitExpandsToTheFlagOrNothing() {
        when(runner.run(anyList(), any(), any(Duration.class)))
                .thenReturn(new CommandResult(0, "", ""))
                .thenReturn(new CommandResult(1, "", ""));

        assertThat(expand("$(cc-option-bit,-mfoo)")).isEqualTo("-mfoo");
        assertThat(expand("$(cc-option-bit,-mbar)")).isEmpty();
    }

    @Test
    @Tag("unit")
    void toolThatCannotStartIsAProbeFailure() {
        when(runner.run(anyList(), any(), any(Duration.class))).thenReturn(CommandResult.failed("no such file"));

        assertThat(expand("$(rustc-option,-Copt-level=2)")).isEqualTo("n");
        assertThat(diagnostics.ofKind(DiagnosticKind.PROBE_FAILURE)).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("rustc-option", "no such file"));
    }
}

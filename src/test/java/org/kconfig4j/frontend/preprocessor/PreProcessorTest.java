package org.kconfig4j.frontend.preprocessor;

import org.kconfig4j.Kconfig;
import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigException;
import org.kconfig4j.diagnostics.KconfigReferenceException;
import org.kconfig4j.diagnostics.KconfigSyntaxException;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.host.CommandResult;
import org.kconfig4j.host.CommandRunner;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.parse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Expands macros, variables and built-in functions on single lines and inside parsed Kconfig files.
 */
public class PreProcessorTest {

    @TempDir
    Path tempDir;

    private DiagnosticsEngine diagnostics;
    private MapEnvironment env;
    private CommandRunner runner;
    private PreProcessor preProcessor;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        diagnostics.setLogDiagnostics(false);
        env = new MapEnvironment();
        runner = mock(CommandRunner.class);
        HostCapabilities host = HostCapabilities.system().withEnvironment(env).withCommandRunner(runner);
        preProcessor = new PreProcessor(diagnostics, host, MacroFunctionRegistry.initialize(), false);
        preProcessor.setLocation(new SourceLocation("Kconfig", 3), null);
    }

    private String expand(String text) {
        return preProcessor.expandWhole(text, List.of());
    }

    @Test
    @Tag("unit")
    void recursiveVariablesExpandOnEachUse() {
        preProcessor.processAssignment("GREETING = hello $(WHO)");
        preProcessor.processAssignment("WHO := world");
        assertThat(expand("$(GREETING)")).isEqualTo("hello world");

        preProcessor.processAssignment("WHO := there");
        assertThat(expand("$(GREETING)")).isEqualTo("hello there");
    }

    @Test
    @Tag("unit")
    void simpleVariablesExpandOnce() {
        preProcessor.processAssignment("WHO := world");
        preProcessor.processAssignment("GREETING := hello $(WHO)");
        preProcessor.processAssignment("WHO := there");

        assertThat(expand("$(GREETING)")).isEqualTo("hello world");
    }

    @Test
    @Tag("unit")
    void appendAddsASingleSpace() {
        preProcessor.processAssignment("FLAGS := -a");
        preProcessor.processAssignment("FLAGS += -b");
        // += on an undefined variable behaves like =
        preProcessor.processAssignment("NEW += $(FLAGS)");

        assertThat(expand("$(FLAGS)")).isEqualTo("-a -b");
        assertThat(preProcessor.getVariables().get("NEW").isRecursive()).isTrue();
        assertThat(expand("$(NEW)")).isEqualTo("-a -b");
    }

    @Test
    @Tag("unit")
    void functionStyleVariablesTakePositionalArguments() {
        preProcessor.processAssignment("pair = $(1)-$(2)");
        preProcessor.processAssignment("$(pair,left,right)-name := built");

        assertThat(expand("$(pair,a,b)")).isEqualTo("a-b");
        assertThat(expand("$(left-right-name)")).isEqualTo("built");
    }

    @Test
    @Tag("unit")
    void selfReferenceIsFatal() {
        preProcessor.processAssignment("LOOP = x $(LOOP)");

        assertThatThrownBy(() -> expand("$(LOOP)"))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("recursively references itself");
    }

    @Test
    @Tag("unit")
    void runawayRecursionIsFatal() {
        preProcessor.processAssignment("f = $(f,$(1))");

        assertThatThrownBy(() -> expand("$(f,x)"))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("seems stuck in infinite recursion");
    }

    @Test
    @Tag("unit")
    void wrongArgumentCountIsFatal() {
        assertThatThrownBy(() -> expand("$(info)"))
                .isInstanceOf(KconfigException.class)
                .hasMessageContaining("bad number of arguments in call to info, expected 1, got 0");
    }

    @Test
    @Tag("unit")
    void environmentVariablesAreRecorded() {
        env.with("ARCH", "riscv");

        assertThat(expand("arch/$(ARCH)/Kconfig")).isEqualTo("arch/riscv/Kconfig");
        assertThat(expand("$(UNSET_THING)")).isEmpty();
        assertThat(preProcessor.getEnvVars()).containsExactly("ARCH");
    }

    @Test
    @Tag("unit")
    void strictModeRejectsUnknownNames() {
        PreProcessor strict = new PreProcessor(diagnostics, HostCapabilities.system().withEnvironment(env),
                MacroFunctionRegistry.initialize(), true);

        assertThatThrownBy(() -> strict.expandWhole("$(NOPE)", List.of()))
                .isInstanceOf(KconfigReferenceException.class)
                .hasMessageContaining("'NOPE' referenced before assignment");
    }

    @Test
    @Tag("unit")
    void shellRunsThroughShAndFlattensOutput() {
        when(runner.run(eq(List.of("sh", "-c", "uname -m")), any(), any(Duration.class)))
                .thenReturn(new CommandResult(0, "x86_64\nextra\n\n", ""));

        assertThat(expand("$(shell,uname -m)")).isEqualTo("x86_64 extra");
        verify(runner).run(eq(List.of("sh", "-c", "uname -m")), any(), any(Duration.class));
    }

    @Test
    @Tag("unit")
    void successAndIfSuccessFollowTheExitStatus() {
        when(runner.run(eq(List.of("sh", "-c", "true")), any(), any(Duration.class)))
                .thenReturn(new CommandResult(0, "", ""));
        when(runner.run(eq(List.of("sh", "-c", "false")), any(), any(Duration.class)))
                .thenReturn(new CommandResult(1, "", ""));

        assertThat(expand("$(success,true)")).isEqualTo("y");
        assertThat(expand("$(failure,true)")).isEqualTo("n");
        assertThat(expand("$(if-success,false,yes,no)")).isEqualTo("no");
    }

    @Test
    @Tag("unit")
    void commandThatCannotRunIsAProbeFailure() {
        when(runner.run(any(), any(), any(Duration.class))).thenReturn(CommandResult.failed("timed out"));

        assertThat(expand("$(success,sleep 100)")).isEqualTo("n");
        assertThat(diagnostics.ofKind(DiagnosticKind.PROBE_FAILURE)).hasSize(1);
    }

    @Test
    @Tag("unit")
    void warningIfReportsOnlyWhenConditionIsY() {
        preProcessor.processAssignment("$(warning-if,y,watch out)");
        preProcessor.processAssignment("$(warning-if,n,quiet)");

        assertThat(diagnostics.warnings()).containsExactly("Kconfig:3: warning: watch out");
    }

    @Test
    @Tag("unit")
    void errorIfIsFatal() {
        assertThatThrownBy(() -> expand("$(error-if,y,stop here)"))
                .isInstanceOf(KconfigException.class)
                .hasMessageContaining("stop here");
        assertThat(expand("$(error-if,n,fine)")).isEmpty();
    }

    @Test
    @Tag("unit")
    void filenameAndLinenoDescribeTheCurrentLine() {
        assertThat(expand("$(filename):$(lineno)")).isEqualTo("Kconfig:3");
    }

    @Test
    @Tag("unit")
    void quotedCommasAndParenthesesDoNotSplitArguments() {
        preProcessor.processAssignment("first = [$(1)]");

        assertThat(expand("$(first,run('a,b', 'c)d'))")).isEqualTo("[run('a,b', 'c)d')]");
        assertThat(expand("$(first,\"x,(y\")")).isEqualTo("[\"x,(y\"]");
        assertThat(expand("$(first,\"\"\"a\",b\"\"\")")).isEqualTo("[\"\"\"a\",b\"\"\"]");
        assertThat(expand("$(first,'a\\',b')")).isEqualTo("['a\\',b']");
    }

    @Test
    @Tag("unit")
    void macrosInsideQuotesExpandBeforeSplitting() {
        preProcessor.processAssignment("X := a,b");
        preProcessor.processAssignment("first = [$(1)]");

        assertThat(expand("$(first,'$(X)')")).isEqualTo("['a,b']");
    }

    @Test
    @Tag("unit")
    void unmatchedQuoteIsAnOrdinaryCharacter() {
        preProcessor.processAssignment("X := a,b");
        preProcessor.processAssignment("$(warning-if,y,don't $(X))");

        assertThat(diagnostics.warnings()).containsExactly("Kconfig:3: warning: don't a,b");
        assertThat(expand("$(info,it's $(X))")).isEmpty();
    }

    @Test
    @Tag("unit")
    void unameReleaseComesFromTheEnvironment() {
        env.with("UNAME_RELEASE", "6.1.0-test");

        assertThat(preProcessor.expandLegacyReferences("/lib/modules/$UNAME_RELEASE/build"))
                .isEqualTo("/lib/modules/6.1.0-test/build");
    }

    @Test
    @Tag("integration")
    void macrosExpandInsideKconfigStatements() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "PREFIX := my",
                "suffix = $(1)-end",
                "",
                "config $(PREFIX)_NAME",
                "\tstring \"name\"",
                "\tdefault \"$(suffix,start)\"",
                "",
                "config HOME_DIR",
                "\tstring",
                "\tdefault \"$HOME_DIR_VALUE/x\""),
                new MapEnvironment().with("HOME_DIR_VALUE", "/home/k"));

        assertThat(kconfig.getSymbol("my_NAME").orElseThrow().strValue()).isEqualTo("start-end");
        assertThat(kconfig.getSymbol("HOME_DIR").orElseThrow().strValue()).isEqualTo("/home/k/x");
        assertThat(kconfig.getVariables()).containsKeys("PREFIX", "suffix");
    }
}

package org.kconfig4j.frontend.semantics;

import org.kconfig4j.Kconfig;
import org.kconfig4j.KconfigOptions;
import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.KconfigReferenceException;
import org.kconfig4j.frontend.preprocessor.MacroFunctionRegistry;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.parse;
import static org.kconfig4j.KconfigFixtures.write;

/**
 * Reports of references to symbols that are never defined.
 */
public class UndefinedSymbolCheckerTest {

    private static final String TREE = lines(
            "config A",
            "\tbool \"A\"",
            "\tdepends on MISSING && 0x10 != 16",
            "\tdepends on MODULES");

    @TempDir
    Path tempDir;

    @Test
    @Tag("integration")
    void undefinedReferencesAreSilentByDefault() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);

        assertThat(kconfig.getDiagnostics().ofKind(DiagnosticKind.REFERENCE)).isEmpty();
    }

    @Test
    @Tag("integration")
    void warnUndefEnvironmentReportsEachUndefinedSymbolOnce() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE, new MapEnvironment().with("KCONFIG_WARN_UNDEF", "y"));

        assertThat(kconfig.getDiagnostics().ofKind(DiagnosticKind.REFERENCE))
                .singleElement()
                .satisfies(d -> assertThat(d.message())
                        .startsWith("undefined symbol MISSING:")
                        .contains("- Referenced at Kconfig:"));
    }

    @Test
    @Tag("integration")
    void errorModeThrows() throws Exception {
        write(tempDir, "Kconfig", TREE);
        KconfigOptions options = KconfigOptions.defaults()
                .withSrctree(tempDir)
                .withUndefinedSymbolChecks(true, true);
        HostCapabilities host = HostCapabilities.system().withEnvironment(new MapEnvironment());

        assertThatThrownBy(() -> new Kconfig(Path.of("Kconfig"), options, host, MacroFunctionRegistry.initialize()))
                .isInstanceOf(KconfigReferenceException.class)
                .hasMessageContaining("undefined symbol MISSING");
    }
}

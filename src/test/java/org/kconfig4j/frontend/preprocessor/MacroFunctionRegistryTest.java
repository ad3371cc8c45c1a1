package org.kconfig4j.frontend.preprocessor;

import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Built-in function registration, argument counts and provider discovery.
 */
public class MacroFunctionRegistryTest {

    @Test
    @Tag("unit")
    void builtInsAreRegisteredWithTheirArgumentBounds() {
        MacroFunctionRegistry registry = MacroFunctionRegistry.initialize();

        assertThat(registry.getAll()).containsKeys("info", "warning-if", "error-if", "error", "filename",
                "lineno", "shell", "success", "failure", "if-success", "cc-option", "as-option", "as-instr",
                "ld-option", "rustc-option", "cc-option-bit");
        assertThat(registry.get("if-success").orElseThrow().expectedArgs()).isEqualTo("3");
        assertThat(registry.get("lineno").orElseThrow().accepts(1)).isFalse();
    }

    @Test
    @Tag("unit")
    void expectedArgumentsDescribeOpenAndClosedRanges() {
        MacroFunctionRegistry registry = new MacroFunctionRegistry();
        registry.register("any", (context, args) -> "", 1, MacroFunctionRegistry.UNBOUNDED);
        registry.register("some", (context, args) -> "", 1, 3);

        assertThat(registry.get("any").orElseThrow().expectedArgs()).isEqualTo("1 or more");
        assertThat(registry.get("any").orElseThrow().accepts(7)).isTrue();
        assertThat(registry.get("some").orElseThrow().expectedArgs()).isEqualTo("1-3");
        assertThat(registry.get("missing")).isEmpty();
    }

    @Test
    @Tag("integration")
    void providersOnTheClassPathAreDiscovered() {
        MacroFunctionRegistry registry = MacroFunctionRegistry.initialize();
        assertThat(registry.get(UpperCaseFunctionProvider.NAME)).isPresent();

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        diagnostics.setLogDiagnostics(false);
        PreProcessor preProcessor = new PreProcessor(diagnostics,
                HostCapabilities.system().withEnvironment(new MapEnvironment()), registry, false);

        assertThat(preProcessor.expandWhole("$(upper,arm64)", List.of())).isEqualTo("ARM64");
    }
}

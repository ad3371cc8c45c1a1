package org.kconfig4j.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;

import org.kconfig4j.Kconfig;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Tristate;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Writes a configuration where bool and tristate symbols are set as high (or as low) as their
 * dependencies allow. Symbols keep the user values from {@code KCONFIG_ALLCONFIG}, which is
 * applied on top.
 */
@Command(
    name = "allconfig",
    description = "Write a configuration with every symbol set to y, m, n or its default"
)
public class AllconfigCommand extends KconfigCommand {

    /**
     * The value bulk-assigned to each symbol.
     */
    public enum Mode {
        YES("allyes.config"),
        MOD("allmod.config"),
        NO("allno.config"),
        DEF("alldef.config");

        private final String allconfigName;

        Mode(String allconfigName) {
            this.allconfigName = allconfigName;
        }
    }

    @Option(
        names = {"--mode"},
        required = true,
        description = "One of: ${COMPLETION-CANDIDATES}"
    )
    private Mode mode;

    @Override
    protected int run(Kconfig kconfig, PrintWriter out, PrintWriter err) throws IOException {
        DiagnosticsEngine diagnostics = kconfig.getDiagnostics();
        boolean warningsEnabled = diagnostics.isWarningsEnabled();

        // many assignments are expected to fail (m on bool symbols, symbols without prompts)
        diagnostics.setWarningsEnabled(false);
        try {
            assignAll(kconfig);
        } finally {
            diagnostics.setWarningsEnabled(warningsEnabled);
        }

        kconfig.loadAllConfig(mode.allconfigName).ifPresent(result -> out.println(result.message()));
        out.println(kconfig.writeConfig().message());
        return 0;
    }

    private void assignAll(Kconfig kconfig) {
        switch (mode) {
            case YES -> {
                for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
                    // choice members are left to the choice selection
                    if (sym.getChoice() == null && sym.getOrigType().isBoolOrTristate()) {
                        sym.setValue(Tristate.Y);
                    }
                }
                for (Choice choice : kconfig.getUniqueChoices()) {
                    choice.setValue(Tristate.Y);
                }
            }
            case MOD -> {
                for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
                    if (sym.getChoice() != null) {
                        continue;
                    }
                    if (sym.getOrigType() == SymbolType.BOOL) {
                        sym.setValue(Tristate.Y);
                    } else if (sym.getOrigType() == SymbolType.TRISTATE) {
                        sym.setValue(Tristate.M);
                    }
                }
                for (Choice choice : kconfig.getUniqueChoices()) {
                    choice.setValue(choice.getOrigType() == SymbolType.BOOL ? Tristate.Y : Tristate.M);
                }
            }
            case NO -> {
                for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
                    if (sym.getOrigType().isBoolOrTristate()) {
                        sym.setValue(sym.isAllnoconfigY() ? Tristate.Y : Tristate.N);
                    }
                }
            }
            case DEF -> {
                // defaults only
            }
        }
    }
}

package org.kconfig4j.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.write;

/**
 * Global options, help output and exit codes of the command line.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void helpListsTheSubcommands() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("--help")).isZero();
        assertThat(cli.out()).contains("setconfig", "allconfig", "olddefconfig", "savedefconfig", "genconfig",
                "dumpvars", "KCONFIG_CONFIG");
    }

    @Test
    @Tag("unit")
    void unknownOptionIsAUsageError() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("olddefconfig", "--bogus")).isEqualTo(2);
        assertThat(cli.err()).contains("--bogus");
    }

    @Test
    @Tag("integration")
    void missingKconfigFileIsReportedAsAnError() {
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("olddefconfig")).isEqualTo(1);
        assertThat(cli.err()).startsWith("error: ");
    }

    @Test
    @Tag("integration")
    void missingSettingsFileIsReportedAsAnError() throws Exception {
        write(tempDir, "Kconfig", lines("config A", "\tbool \"a\""));
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("--config", tempDir.resolve("nope.conf").toString(), "olddefconfig")).isEqualTo(1);
        assertThat(cli.err()).contains("error: Configuration file not found");
    }

    @Test
    @Tag("integration")
    void settingsFileChangesTheSymbolPrefix() throws Exception {
        write(tempDir, "Kconfig", lines("config A", "\tbool \"a\"", "\tdefault y"));
        Path settings = write(tempDir, "settings.conf", lines("kconfig.config-prefix = \"KC_\""));
        CliHarness cli = new CliHarness(tempDir);

        assertThat(cli.run("--config", settings.toString(), "olddefconfig")).isZero();
        assertThat(Files.readString(cli.configFile())).isEqualTo("KC_A=y\n");
    }
}

package org.kconfig4j.cli.commands;

import org.kconfig4j.cli.CliHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.write;

/**
 * Minimal configuration output and olddefconfig rewrites.
 */
public class SavedefconfigCommandTest {

    @TempDir
    Path tempDir;

    private CliHarness cli;

    @BeforeEach
    void setUp() throws Exception {
        write(tempDir, "Kconfig", CommandTrees.SAMPLE);
        cli = new CliHarness(tempDir);
    }

    @Test
    @Tag("integration")
    void minimalConfigurationLeavesOutDefaults() throws Exception {
        Files.writeString(cli.configFile(), lines("CONFIG_NET=y", "CONFIG_LEVEL=2", "CONFIG_NAME=\"x\""));
        Path out = tempDir.resolve("defconfig");

        assertThat(cli.run("savedefconfig", "--out", out.toString())).isZero();

        assertThat(cli.out()).contains("Minimal configuration saved to '" + out + "'");
        assertThat(Files.readString(out)).contains("CONFIG_NET=y").doesNotContain("LEVEL", "NAME");
    }

    @Test
    @Tag("integration")
    void olddefconfigDropsUnknownSymbolsAndFillsInDefaults() throws Exception {
        Files.writeString(cli.configFile(), lines("CONFIG_LEVEL=3", "CONFIG_GONE=y"));

        assertThat(cli.run("olddefconfig")).isZero();

        assertThat(cli.out()).contains("Loaded configuration", "Configuration saved to");
        assertThat(Files.readString(cli.configFile()))
                .contains("CONFIG_LEVEL=3", "CONFIG_NAME=\"x\"")
                .doesNotContain("GONE");
        assertThat(tempDir.resolve(".config.old")).exists();
    }
}

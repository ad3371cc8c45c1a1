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
 * Header, dependency and listing outputs of genconfig and dumpvars.
 */
public class GenconfigCommandTest {

    @TempDir
    Path tempDir;

    private CliHarness cli;

    @BeforeEach
    void setUp() throws Exception {
        write(tempDir, "Kconfig", lines(
                "config NET",
                "\tbool \"networking\"",
                "\tdefault y",
                "",
                "config ARCH_NAME",
                "\tstring",
                "\tdefault \"$(ARCH)\"",
                "",
                "source \"net/Kconfig\""));
        write(tempDir, "net/Kconfig", lines(
                "config NET_PORT",
                "\tint \"port\"",
                "\tdepends on NET",
                "\tdefault 80"));
        cli = new CliHarness(tempDir);
        cli.env().with("ARCH", "arm");
    }

    @Test
    @Tag("integration")
    void writesTheHeaderFromTheEnvironment() throws Exception {
        assertThat(cli.run("genconfig")).isZero();

        Path header = tempDir.resolve("include/generated/autoconf.h");
        assertThat(cli.out()).contains("Kconfig header saved to '" + header + "'");
        assertThat(Files.readString(header)).contains(
                "#define CONFIG_NET 1", "#define CONFIG_ARCH_NAME \"arm\"", "#define CONFIG_NET_PORT 80");
    }

    @Test
    @Tag("integration")
    void writesEveryRequestedOutput() throws Exception {
        Path header = tempDir.resolve("out/config.h");
        Path configOut = tempDir.resolve("out/full.config");
        Path deps = tempDir.resolve("out/deps");
        Path files = tempDir.resolve("out/files.txt");
        Path envs = tempDir.resolve("out/env.txt");

        int status = cli.run("genconfig", "--header-path", header.toString(), "--config-out", configOut.toString(),
                "--sync-deps", deps.toString(), "--file-list", files.toString(), "--env-list", envs.toString());

        assertThat(status).isZero();
        assertThat(header).exists();
        assertThat(Files.readString(configOut)).contains("CONFIG_NET_PORT=80");
        assertThat(deps.resolve("net/port.h")).exists();
        assertThat(Files.readString(deps.resolve("auto.conf"))).contains("CONFIG_NET=y");
        assertThat(Files.readString(files)).isEqualTo("Kconfig\nnet/Kconfig\n");
        assertThat(Files.readString(envs)).contains("ARCH=arm\n");
    }

    @Test
    @Tag("integration")
    void dumpvarsPrintsTheReferencedVariables() {
        assertThat(cli.run("dumpvars")).isZero();
        assertThat(cli.out()).contains("ARCH='arm'");
    }
}

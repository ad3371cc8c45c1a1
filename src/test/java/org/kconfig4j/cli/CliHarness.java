package org.kconfig4j.cli;

import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

/**
 * Runs the command line against a source tree in a temporary directory, with a fixed environment
 * and captured output.
 */
public final class CliHarness {

    private final Path srctree;
    private final MapEnvironment env;
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    /**
     * @param srctree Directory holding the top-level {@code Kconfig}. The configuration file is
     *                {@code srctree/.config}.
     */
    public CliHarness(Path srctree) {
        this.srctree = srctree;
        this.env = new MapEnvironment()
                .with("srctree", srctree.toString())
                .with("KCONFIG_CONFIG", srctree.resolve(".config").toString())
                .with("KCONFIG_AUTOHEADER", srctree.resolve("include/generated/autoconf.h").toString());
    }

    public MapEnvironment env() {
        return env;
    }

    public Path configFile() {
        return srctree.resolve(".config");
    }

    public int run(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine(HostCapabilities.system().withEnvironment(env));
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    public String out() {
        return out.toString();
    }

    public String err() {
        return err.toString();
    }
}

package org.kconfig4j.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;

import org.kconfig4j.Kconfig;

import picocli.CommandLine.Command;

/**
 * Loads the configuration and writes it back, giving new symbols their default values.
 */
@Command(
    name = "olddefconfig",
    description = "Update the configuration file, using defaults for new symbols"
)
public class OlddefconfigCommand extends KconfigCommand {

    @Override
    protected int run(Kconfig kconfig, PrintWriter out, PrintWriter err) throws IOException {
        out.println(kconfig.loadConfig().message());
        out.println(kconfig.writeConfig().message());
        return 0;
    }
}

package org.kconfig4j.cli.commands;

import java.io.PrintWriter;
import java.util.stream.Collectors;

import org.kconfig4j.Kconfig;
import org.kconfig4j.host.Environment;

import picocli.CommandLine.Command;

/**
 * Prints {@code NAME='value'} for every environment variable the Kconfig tree references, in a
 * form that can be prefixed to a command to reproduce the parse.
 */
@Command(
    name = "dumpvars",
    description = "Print the environment variables referenced by the Kconfig files"
)
public class DumpvarsCommand extends KconfigCommand {

    @Override
    protected int run(Kconfig kconfig, PrintWriter out, PrintWriter err) {
        Environment env = kconfig.getHost().environment();
        out.println(kconfig.envVars().stream()
                .map(name -> name + "='" + env.get(name).orElse("") + "'")
                .collect(Collectors.joining(" ")));
        return 0;
    }
}

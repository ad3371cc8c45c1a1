package org.kconfig4j.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;

import org.kconfig4j.Kconfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "savedefconfig",
    description = "Write a minimal configuration that only holds values differing from the defaults"
)
public class SavedefconfigCommand extends KconfigCommand {

    @Option(
        names = {"--out"},
        defaultValue = "defconfig",
        description = "Output file (default: ${DEFAULT-VALUE})"
    )
    private Path outFile;

    @Override
    protected int run(Kconfig kconfig, PrintWriter out, PrintWriter err) throws IOException {
        out.println(kconfig.loadConfig().message());
        out.println(kconfig.writeMinConfig(outFile, null).message());
        return 0;
    }
}

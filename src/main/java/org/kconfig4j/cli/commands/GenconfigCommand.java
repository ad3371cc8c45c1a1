package org.kconfig4j.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.stream.Collectors;

import org.kconfig4j.Kconfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Generates the build inputs from the configuration: the C header and, on request, the
 * dependency markers, a copy of the configuration and the lists of Kconfig files and
 * environment variables the tree depends on.
 */
@Command(
    name = "genconfig",
    description = "Generate the C header and dependency files from the configuration"
)
public class GenconfigCommand extends KconfigCommand {

    @Option(
        names = {"--header-path"},
        description = "C header to write (default: KCONFIG_AUTOHEADER or kconfig.files.autoconf)"
    )
    private Path headerPath;

    @Option(
        names = {"--config-out"},
        description = "Also write the configuration in .config format to this file"
    )
    private Path configOut;

    @Option(
        names = {"--sync-deps"},
        arity = "0..1",
        fallbackValue = "",
        description = "Update the dependency marker files in this directory "
                + "(default without a value: kconfig.files.sync-deps-dir)"
    )
    private String syncDepsDir;

    @Option(
        names = {"--file-list"},
        description = "Write the list of parsed Kconfig files to this file"
    )
    private Path fileList;

    @Option(
        names = {"--env-list"},
        description = "Write the referenced environment variables as NAME=value lines to this file"
    )
    private Path envList;

    @Override
    protected int run(Kconfig kconfig, PrintWriter out, PrintWriter err) throws IOException {
        out.println(kconfig.loadConfig().message());

        Path header = headerPath != null ? headerPath : Path.of(kconfig.getOptions().autoconfFile());
        out.println(kconfig.writeAutoconf(header, null).message());

        if (configOut != null) {
            out.println(kconfig.writeConfig(configOut, null).message());
        }

        if (syncDepsDir != null) {
            String dir = syncDepsDir.isEmpty() ? kconfig.getOptions().syncDepsDir() : syncDepsDir;
            kconfig.syncDeps(Path.of(dir));
        }

        if (fileList != null) {
            String files = kconfig.kconfigFilenames().stream()
                    .map(name -> name + "\n")
                    .collect(Collectors.joining());
            kconfig.getHost().fileSystem().writeString(fileList, files);
        }

        if (envList != null) {
            String vars = kconfig.envVars().stream()
                    .map(name -> name + "=" + kconfig.getHost().environment().get(name).orElse("") + "\n")
                    .collect(Collectors.joining());
            kconfig.getHost().fileSystem().writeString(envList, vars);
        }
        return 0;
    }
}

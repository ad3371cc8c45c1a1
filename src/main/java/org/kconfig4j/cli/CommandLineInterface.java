package org.kconfig4j.cli;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.kconfig4j.Kconfig;
import org.kconfig4j.KconfigOptions;
import org.kconfig4j.cli.commands.AllconfigCommand;
import org.kconfig4j.cli.commands.DumpvarsCommand;
import org.kconfig4j.cli.commands.GenconfigCommand;
import org.kconfig4j.cli.commands.OlddefconfigCommand;
import org.kconfig4j.cli.commands.SavedefconfigCommand;
import org.kconfig4j.cli.commands.SetconfigCommand;
import org.kconfig4j.cli.config.ConfigLoader;
import org.kconfig4j.frontend.preprocessor.MacroFunctionRegistry;
import org.kconfig4j.host.HostCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "kconfig4j",
    mixinStandardHelpOptions = true,
    version = "kconfig4j 1.0",
    description = "Reads Kconfig trees and reads, edits and writes .config files",
    subcommands = {
        SetconfigCommand.class,
        AllconfigCommand.class,
        OlddefconfigCommand.class,
        SavedefconfigCommand.class,
        GenconfigCommand.class,
        DumpvarsCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Environment:",
        "  srctree, CONFIG_, KCONFIG_CONFIG, KCONFIG_AUTOHEADER, KCONFIG_CONFIG_HEADER,",
        "  KCONFIG_AUTOHEADER_HEADER, KCONFIG_WARN_UNDEF, KCONFIG_WARN_UNDEF_ASSIGN and",
        "  KCONFIG_ALLCONFIG are honoured like in the C tools."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Settings file (default: config/kconfig4j.conf)"
    )
    private File configFile;

    @Option(
        names = {"-k", "--kconfig"},
        defaultValue = "Kconfig",
        description = "Top-level Kconfig file (default: ${DEFAULT-VALUE})"
    )
    private Path kconfigFile;

    private final HostCapabilities host;
    private Config config;

    public CommandLineInterface() {
        this(HostCapabilities.system());
    }

    CommandLineInterface(HostCapabilities host) {
        this.host = host;
    }

    @Override
    public Integer call() {
        // Without a subcommand, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates a fully configured CommandLine instance.
     * <p>
     * Use this method in tests to get the same configuration as the CLI entry point.
     */
    public static CommandLine createCommandLine() {
        return createCommandLine(HostCapabilities.system());
    }

    /**
     * @param host The environment, process and file capabilities handed to the engine.
     */
    public static CommandLine createCommandLine(HostCapabilities host) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface(host));
        commandLine.setCommandName("kconfig4j");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    /**
     * @return The resolved settings, loaded on first use.
     * @throws IllegalArgumentException If the file named with {@code --config} does not exist.
     * @throws ConfigException If the settings cannot be parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = ConfigLoader.resolve(configFile, Path.of(""), (level, message) -> {
                switch (level) {
                    case INFO -> log.debug(message);
                    case WARN -> log.warn(message);
                }
            });
            if (config.hasPath("logging.format")) {
                final String format = config.getString("logging.format");
                System.setProperty("kconfig4j.logging.format",
                        "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
                reconfigureLogback();
            }
        }
        return config;
    }

    public HostCapabilities getHost() {
        return host;
    }

    /**
     * Parses the Kconfig tree named with {@code --kconfig}, using the resolved settings.
     *
     * @throws IOException If the top-level file cannot be read.
     */
    public Kconfig openKconfig() throws IOException {
        KconfigOptions options = KconfigOptions.fromConfig(getConfig());
        HostCapabilities effectiveHost = host.withCommandTimeout(options.commandTimeout());
        return new Kconfig(kconfigFile, options, effectiveHost, MacroFunctionRegistry.initialize());
    }

    private void reconfigureLogback() {
        try {
            ch.qos.logback.classic.LoggerContext context =
                    (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            ch.qos.logback.classic.joran.JoranConfigurator configurator =
                    new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}

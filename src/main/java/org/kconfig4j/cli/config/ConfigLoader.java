package org.kconfig4j.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

/**
 * Finds and loads the HOCON settings of the {@code kconfig4j} tools.
 * <p>
 * Layers, from highest to lowest precedence:
 * <ol>
 *   <li>Java system properties ({@code -Dkconfig.warnings.enabled=false})</li>
 *   <li>the settings file found by {@link #resolve}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The {@code srctree}, {@code CONFIG_} and {@code KCONFIG_*} environment variables are applied
 * later, by {@link org.kconfig4j.KconfigOptions#withEnvironment}, so they win over every layer.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "kconfig4j.conf";

    private ConfigLoader() {
    }

    /**
     * Message severity levels for configuration resolution feedback.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the settings file is looked up.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the settings from the first of:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/kconfig4j.conf} under {@code workingDir}</li>
     *   <li>{@code APP_HOME/config/kconfig4j.conf} next to the installed jar</li>
     *   <li>classpath defaults alone</li>
     * </ol>
     *
     * @param explicitConfigFile File from the command line, or {@code null}.
     * @param workingDir         Directory the relative {@code config/} lookup starts from.
     * @param handler            Receives progress messages.
     * @throws IllegalArgumentException If an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException If a file cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, Path workingDir, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO, "Using settings from --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: " + systemConfigFile);
            }
            handler.log(MessageLevel.INFO, "Using settings from -Dconfig.file: " + systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        Path local = workingDir.resolve(CONFIG_DIR).resolve(CONFIG_FILE_NAME);
        if (Files.isRegularFile(local)) {
            handler.log(MessageLevel.INFO, "Using settings from " + local.toAbsolutePath());
            return loadFromFile(local.toFile());
        }

        Optional<File> installed = detectInstallationConfigFile();
        if (installed.isPresent()) {
            handler.log(MessageLevel.INFO, "Using settings from installation directory: " + installed.get());
            return loadFromFile(installed.get());
        }

        // the defaults are complete, so a missing settings file is normal
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/kconfig4j.conf}, where the running jar lives in
     * {@code APP_HOME/lib}.
     */
    private static Optional<File> detectInstallationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return Optional.empty();
        }
        File jarOrClasses;
        try {
            jarOrClasses = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!jarOrClasses.isFile() || jarOrClasses.getParentFile() == null) {
            // classes directory during development
            return Optional.empty();
        }
        File appHome = jarOrClasses.getParentFile().getParentFile();
        if (appHome == null) {
            return Optional.empty();
        }
        File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.isFile() ? Optional.of(configFile) : Optional.empty();
    }
}

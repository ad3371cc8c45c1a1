package org.kconfig4j;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.kconfig4j.host.Environment;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Engine settings, read from the {@code kconfig} section of a Typesafe {@link Config} and then
 * overridden by the environment variables the C tools honour ({@code srctree}, {@code CONFIG_},
 * {@code KCONFIG_*}).
 *
 * @param srctree             Directory Kconfig and sourced files are looked up in, or {@code null}.
 * @param configPrefix        Prefix of symbol names in written files.
 * @param warningsEnabled     Whether warnings are recorded at all.
 * @param warningsToLog       Whether each diagnostic is also logged.
 * @param warnUndefined       Whether undefined symbol references are reported after parsing.
 * @param undefinedAsError    Whether an undefined symbol reference is fatal (implies reporting).
 * @param warnAssignUndefined Whether loading a value for an undefined symbol warns.
 * @param warnAssignOverride  Whether loading a second, different value for a symbol warns.
 * @param warnAssignRedundant Whether loading the same value twice for a symbol warns.
 * @param strictPreprocessor  Whether {@code $(NAME)} of an unknown name is an error.
 * @param commandTimeout      Timeout for {@code shell} commands and probes.
 * @param configFile          Default configuration file name.
 * @param autoconfFile        Default C header file name.
 * @param syncDepsDir         Default directory for dependency marker files.
 * @param configHeader        Text written at the top of configuration files.
 * @param autoconfHeader      Text written at the top of the C header.
 */
public record KconfigOptions(
        Path srctree,
        String configPrefix,
        boolean warningsEnabled,
        boolean warningsToLog,
        boolean warnUndefined,
        boolean undefinedAsError,
        boolean warnAssignUndefined,
        boolean warnAssignOverride,
        boolean warnAssignRedundant,
        boolean strictPreprocessor,
        Duration commandTimeout,
        String configFile,
        String autoconfFile,
        String syncDepsDir,
        String configHeader,
        String autoconfHeader) {

    private static final String ROOT = "kconfig";

    /**
     * @return The options from {@code reference.conf} alone.
     */
    public static KconfigOptions defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the {@code kconfig} section of {@code config}.
     *
     * @throws com.typesafe.config.ConfigException If a setting is missing or has the wrong type.
     */
    public static KconfigOptions fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        String srctree = c.getString("srctree");
        return new KconfigOptions(
                srctree.isBlank() ? null : Path.of(srctree),
                c.getString("config-prefix"),
                c.getBoolean("warnings.enabled"),
                c.getBoolean("warnings.to-log"),
                c.getBoolean("warnings.undefined-symbols"),
                c.getBoolean("warnings.undefined-as-error"),
                c.getBoolean("warnings.undefined-assign"),
                c.getBoolean("warnings.override-assign"),
                c.getBoolean("warnings.redundant-assign"),
                c.getBoolean("preprocessor.strict"),
                c.getDuration("preprocessor.command-timeout"),
                c.getString("files.config"),
                c.getString("files.autoconf"),
                c.getString("files.sync-deps-dir"),
                c.getString("files.config-header"),
                c.getString("files.autoconf-header"));
    }

    /**
     * Applies the environment variables of the C tools on top of these options. Unset variables
     * leave the option as it is.
     */
    public KconfigOptions withEnvironment(Environment env) {
        Path newSrctree = env.get("srctree").filter(s -> !s.isEmpty()).map(Path::of).orElse(srctree);
        boolean undefined = warnUndefined || isY(env, "KCONFIG_WARN_UNDEF") || isY(env, "KCONFIG_STRICT");
        boolean undefinedAssign = warnAssignUndefined || isY(env, "KCONFIG_WARN_UNDEF_ASSIGN");
        return new KconfigOptions(
                newSrctree,
                env.get("CONFIG_").orElse(configPrefix),
                warningsEnabled,
                warningsToLog,
                undefined,
                undefinedAsError,
                undefinedAssign,
                warnAssignOverride,
                warnAssignRedundant,
                strictPreprocessor,
                commandTimeout,
                env.get("KCONFIG_CONFIG").orElse(configFile),
                env.get("KCONFIG_AUTOHEADER").orElse(autoconfFile),
                syncDepsDir,
                env.get("KCONFIG_CONFIG_HEADER").orElse(configHeader),
                env.get("KCONFIG_AUTOHEADER_HEADER").orElse(autoconfHeader));
    }

    public KconfigOptions withSrctree(Path newSrctree) {
        return new KconfigOptions(newSrctree, configPrefix, warningsEnabled, warningsToLog, warnUndefined,
                undefinedAsError, warnAssignUndefined, warnAssignOverride, warnAssignRedundant, strictPreprocessor,
                commandTimeout, configFile, autoconfFile, syncDepsDir, configHeader, autoconfHeader);
    }

    public KconfigOptions withWarningsEnabled(boolean enabled) {
        return new KconfigOptions(srctree, configPrefix, enabled, warningsToLog, warnUndefined,
                undefinedAsError, warnAssignUndefined, warnAssignOverride, warnAssignRedundant, strictPreprocessor,
                commandTimeout, configFile, autoconfFile, syncDepsDir, configHeader, autoconfHeader);
    }

    public KconfigOptions withUndefinedSymbolChecks(boolean warn, boolean asError) {
        return new KconfigOptions(srctree, configPrefix, warningsEnabled, warningsToLog, warn,
                asError, warnAssignUndefined, warnAssignOverride, warnAssignRedundant, strictPreprocessor,
                commandTimeout, configFile, autoconfFile, syncDepsDir, configHeader, autoconfHeader);
    }

    public KconfigOptions withStrictPreprocessor(boolean strict) {
        return new KconfigOptions(srctree, configPrefix, warningsEnabled, warningsToLog, warnUndefined,
                undefinedAsError, warnAssignUndefined, warnAssignOverride, warnAssignRedundant, strict,
                commandTimeout, configFile, autoconfFile, syncDepsDir, configHeader, autoconfHeader);
    }

    /**
     * @return The source tree, if one is set.
     */
    public Optional<Path> srctreePath() {
        return Optional.ofNullable(srctree);
    }

    private static boolean isY(Environment env, String name) {
        return env.get(name).map("y"::equals).orElse(false);
    }
}

package org.kconfig4j.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.kconfig4j.cli.config.ConfigLoader.ConfigMessageHandler;
import org.kconfig4j.cli.config.ConfigLoader.MessageLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Settings file lookup and fallback to the classpath defaults.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigMessageHandler handler;

    @BeforeEach
    void setUp() {
        handler = mock(ConfigMessageHandler.class);
    }

    @Test
    @Tag("unit")
    void explicitFileOverridesTheDefaults() throws Exception {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, "kconfig.config-prefix = \"CUSTOM_\"\n");

        Config config = ConfigLoader.resolve(file.toFile(), tempDir, handler);

        assertThat(config.getString("kconfig.config-prefix")).isEqualTo("CUSTOM_");
        assertThat(config.getString("kconfig.files.config")).isEqualTo(".config");
        verify(handler).log(eq(MessageLevel.INFO), contains("--config"));
    }

    @Test
    @Tag("unit")
    void missingExplicitFileIsRejected() {
        File missing = tempDir.resolve("missing.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.resolve(missing, tempDir, handler))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    @Tag("unit")
    void settingsUnderTheWorkingDirectoryAreFound() throws Exception {
        Path local = tempDir.resolve(ConfigLoader.CONFIG_DIR).resolve(ConfigLoader.CONFIG_FILE_NAME);
        Files.createDirectories(local.getParent());
        Files.writeString(local, "kconfig.warnings.enabled = false\n");

        Config config = ConfigLoader.resolve(null, tempDir, handler);

        assertThat(config.getBoolean("kconfig.warnings.enabled")).isFalse();
        verify(handler).log(eq(MessageLevel.INFO), contains(ConfigLoader.CONFIG_FILE_NAME));
    }

    @Test
    @Tag("unit")
    void withoutASettingsFileTheDefaultsApplySilently() {
        Config config = ConfigLoader.resolve(null, tempDir, handler);

        assertThat(config.getString("kconfig.config-prefix")).isEqualTo("CONFIG_");
        assertThat(config.getDuration("kconfig.preprocessor.command-timeout").getSeconds()).isEqualTo(60);
        verify(handler, never()).log(eq(MessageLevel.WARN), anyString());
    }

    @Test
    @Tag("unit")
    void substitutionsResolveAgainstTheDefaults() throws Exception {
        Path file = tempDir.resolve("subst.conf");
        Files.writeString(file, "kconfig.files.autoconf = ${kconfig.files.sync-deps-dir}\"/../autoconf.h\"\n");

        Config config = ConfigLoader.resolve(file.toFile(), tempDir, handler);

        assertThat(config.getString("kconfig.files.autoconf")).isEqualTo("include/config/../autoconf.h");
    }

    @Test
    @Tag("unit")
    void malformedFileIsAConfigException() throws Exception {
        Path file = tempDir.resolve("broken.conf");
        Files.writeString(file, "kconfig {\n");

        assertThatThrownBy(() -> ConfigLoader.resolve(file.toFile(), tempDir, handler))
                .isInstanceOf(ConfigException.class);
    }
}

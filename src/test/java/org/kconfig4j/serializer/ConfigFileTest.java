package org.kconfig4j.serializer;

import org.kconfig4j.Kconfig;
import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.host.MapEnvironment;
import org.kconfig4j.model.AssignmentResult;
import org.kconfig4j.model.Symbol;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.parse;
import static org.kconfig4j.KconfigFixtures.write;

/**
 * Writes and reads {@code .config} files, minimal configurations and C headers.
 */
public class ConfigFileTest {

    private static final String TREE = lines(
            "config A",
            "\tbool \"A\"",
            "\tdefault y",
            "",
            "menu \"Options\"",
            "",
            "config S",
            "\tstring \"S\"",
            "\tdefault \"x\"",
            "",
            "config I",
            "\tint \"I\"",
            "\trange 0 100",
            "\tdefault 3",
            "",
            "endmenu",
            "",
            "config B",
            "\tbool \"B\"");

    @TempDir
    Path tempDir;

    private Symbol sym(Kconfig kconfig, String name) {
        return kconfig.getSymbol(name).orElseThrow();
    }

    @Test
    @Tag("integration")
    void writesSymbolsInMenuOrderWithMenuComments() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Path out = tempDir.resolve("out/.config");

        WriteResult result = kconfig.writeConfig(out, null);

        assertThat(result.changed()).isTrue();
        assertThat(result.message()).isEqualTo("Configuration saved to '" + out + "'");
        assertThat(Files.readString(out)).isEqualTo(
                "CONFIG_A=y\n"
                + "\n"
                + "#\n"
                + "# Options\n"
                + "#\n"
                + "CONFIG_S=\"x\"\n"
                + "CONFIG_I=3\n"
                + "# end of Options\n"
                + "\n"
                + "# CONFIG_B is not set\n");
    }

    @Test
    @Tag("integration")
    void unchangedConfigurationIsNotRewritten() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Path out = tempDir.resolve(".config");

        kconfig.writeConfig(out, "# header\n");
        WriteResult again = kconfig.writeConfig(out, "# header\n");

        assertThat(again.changed()).isFalse();
        assertThat(again.message()).isEqualTo("No change to configuration in '" + out + "'");
        assertThat(tempDir.resolve(".config.old")).doesNotExist();

        sym(kconfig, "B").setValue("y");
        assertThat(kconfig.writeConfig(out, "# header\n").changed()).isTrue();
        assertThat(Files.readString(tempDir.resolve(".config.old"))).contains("# CONFIG_B is not set");
        assertThat(Files.readString(out)).startsWith("# header\n").contains("CONFIG_B=y");
    }

    @Test
    @Tag("integration")
    void loadsValuesAndReportsUnknownAndMalformedLines() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Path config = write(tempDir, "my.config", lines(
                "# CONFIG_A is not set",
                "CONFIG_S=\"say \\\"hi\\\"\"",
                "CONFIG_I=7",
                "CONFIG_GONE=y",
                "this is not a setting"));

        LoadResult result = kconfig.loadConfig(config, true);

        assertThat(result.message()).isEqualTo("Loaded configuration '" + config + "'");
        assertThat(sym(kconfig, "A").strValue()).isEqualTo("n");
        assertThat(sym(kconfig, "S").strValue()).isEqualTo("say \"hi\"");
        assertThat(sym(kconfig, "I").strValue()).isEqualTo("7");
        assertThat(result.missingSymbols()).containsExactly(new LoadResult.MissingSymbol("GONE", "y"));
        assertThat(result.assignments())
                .filteredOn(a -> a.name().equals("I"))
                .singleElement()
                .satisfies(a -> assertThat(a.result()).isEqualTo(AssignmentResult.ASSIGNED));
        assertThat(kconfig.getDiagnostics().ofKind(DiagnosticKind.ASSIGNMENT))
                .singleElement()
                .satisfies(d -> {
                    assertThat(d.message()).contains("ignoring malformed line");
                    assertThat(d.location().line()).isEqualTo(5);
                });
    }

    @Test
    @Tag("integration")
    void replaceDropsValuesTheFileDoesNotMentionButMergeKeepsThem() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Path onlyB = write(tempDir, "b.config", lines("CONFIG_B=y"));

        sym(kconfig, "S").setValue("user");
        LoadResult merged = kconfig.loadConfig(onlyB, false);
        assertThat(merged.message()).startsWith("Merged configuration");
        assertThat(sym(kconfig, "S").strValue()).isEqualTo("user");

        kconfig.loadConfig(onlyB, true);
        assertThat(sym(kconfig, "S").strValue()).isEqualTo("x");
        assertThat(sym(kconfig, "B").strValue()).isEqualTo("y");
    }

    @Test
    @Tag("integration")
    void outOfRangeValueKeepsThePreviousOneAndIsReported() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        sym(kconfig, "I").setValue("9");
        Path config = write(tempDir, "range.config", lines("CONFIG_I=500"));

        kconfig.loadConfig(config, true);

        assertThat(sym(kconfig, "I").strValue()).isEqualTo("9");
        assertThat(kconfig.getDiagnostics().ofKind(DiagnosticKind.RANGE)).hasSize(1);
    }

    @Test
    @Tag("integration")
    void settingASymbolTwiceWarns() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Path config = write(tempDir, "twice.config", lines("CONFIG_B=y", "CONFIG_B=n"));

        kconfig.loadConfig(config, true);

        assertThat(sym(kconfig, "B").strValue()).isEqualTo("n");
        assertThat(kconfig.warnings()).anyMatch(w -> w.contains("set more than once"));
    }

    @Test
    @Tag("integration")
    void missingStandardConfigurationFallsBackOnDefaults() throws Exception {
        Path missing = tempDir.resolve("nothing-here.config");
        Kconfig kconfig = parse(tempDir, TREE, new MapEnvironment().with("KCONFIG_CONFIG", missing.toString()));

        LoadResult result = kconfig.loadConfig();

        assertThat(result.message()).isEqualTo("Using default symbol values (no '" + missing + "')");
        assertThat(result.assignments()).isEmpty();
    }

    @Test
    @Tag("integration")
    void writtenConfigurationLoadsBackToTheSameValues() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        sym(kconfig, "S").setValue("back\\slash \"and quotes\"");
        sym(kconfig, "I").setValue("42");
        sym(kconfig, "A").setValue("n");
        Path out = tempDir.resolve(".config");
        kconfig.writeConfig(out, null);

        Kconfig fresh = parse(tempDir, TREE);
        fresh.loadConfig(out, true);

        assertThat(sym(fresh, "S").strValue()).isEqualTo("back\\slash \"and quotes\"");
        assertThat(sym(fresh, "I").strValue()).isEqualTo("42");
        assertThat(sym(fresh, "A").strValue()).isEqualTo("n");
    }

    @Test
    @Tag("integration")
    void minimalConfigurationOnlyHoldsNonDefaultValues() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        sym(kconfig, "B").setValue("y");
        sym(kconfig, "I").setValue("3");
        Path out = tempDir.resolve("defconfig");

        WriteResult result = kconfig.writeMinConfig(out, null);

        assertThat(result.message()).isEqualTo("Minimal configuration saved to '" + out + "'");
        assertThat(Files.readString(out)).isEqualTo("CONFIG_B=y\n");
        assertThat(kconfig.writeMinConfig(out, null).changed()).isFalse();
    }

    @Test
    @Tag("integration")
    void autoconfHeaderHasDefinesAndNotSetComments() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "config MODULES",
                "\tbool \"modules\"",
                "\toption modules",
                "\tdefault y",
                "",
                "config DRV",
                "\ttristate \"driver\"",
                "\tdefault m",
                "",
                "config OFF",
                "\tbool \"off\"",
                "",
                "config ADDR",
                "\thex \"address\"",
                "\tdefault 1000",
                "",
                "config LABEL",
                "\tstring \"label\"",
                "\tdefault \"a\\\"b\""));
        Path header = tempDir.resolve("include/generated/autoconf.h");

        WriteResult result = kconfig.writeAutoconf(header, "/* generated */\n");

        assertThat(result.message()).isEqualTo("Kconfig header saved to '" + header + "'");
        assertThat(Files.readString(header)).isEqualTo(
                "/* generated */\n"
                + "#define CONFIG_MODULES 1\n"
                + "#define CONFIG_DRV_MODULE 1\n"
                + "/* CONFIG_OFF is not set */\n"
                + "#define CONFIG_ADDR 0x1000\n"
                + "#define CONFIG_LABEL \"a\\\"b\"\n");
        assertThat(kconfig.writeAutoconf(header, "/* generated */\n").changed()).isFalse();
    }
}

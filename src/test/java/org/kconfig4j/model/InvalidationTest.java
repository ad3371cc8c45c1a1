package org.kconfig4j.model;

import org.kconfig4j.Kconfig;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.parse;

/**
 * Checks which cached values an assignment clears.
 */
public class InvalidationTest {

    @TempDir
    Path tempDir;

    private static final String TREE = lines(
            "config MODULES",
            "\tbool \"modules\"",
            "\toption modules",
            "",
            "config A",
            "\tbool \"a\"",
            "\tselect C",
            "",
            "config B",
            "\tbool \"b\"",
            "\tdepends on A",
            "\tdefault y",
            "",
            "config C",
            "\tbool \"c\"",
            "",
            "config D",
            "\tbool \"d\"",
            "\tdefault y");

    @Test
    @Tag("unit")
    void assignmentOnlyInvalidatesReachableItems() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Symbol a = kconfig.getSymbol("A").orElseThrow();
        Symbol b = kconfig.getSymbol("B").orElseThrow();
        Symbol c = kconfig.getSymbol("C").orElseThrow();
        Symbol d = kconfig.getSymbol("D").orElseThrow();

        assertThat(a.getDependents()).contains(b, c).doesNotContain(d);

        assertThat(b.strValue()).isEqualTo("n");
        assertThat(c.strValue()).isEqualTo("n");
        assertThat(d.strValue()).isEqualTo("y");
        assertThat(d.hasCachedValues()).isTrue();

        a.setValue("y");

        assertThat(b.hasCachedValues()).isFalse();
        assertThat(c.hasCachedValues()).isFalse();
        assertThat(d.hasCachedValues()).isTrue();

        assertThat(b.strValue()).isEqualTo("y");
        assertThat(c.strValue()).isEqualTo("y");
    }

    @Test
    @Tag("unit")
    void changingModulesInvalidatesEverything() throws Exception {
        Kconfig kconfig = parse(tempDir, TREE);
        Symbol d = kconfig.getSymbol("D").orElseThrow();
        assertThat(d.strValue()).isEqualTo("y");

        kconfig.getSymbol("MODULES").orElseThrow().setValue("y");

        assertThat(d.hasCachedValues()).isFalse();
        assertThat(d.strValue()).isEqualTo("y");
    }
}

package org.kconfig4j.frontend.semantics;

import org.kconfig4j.diagnostics.DependencyLoopException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.parse;

/**
 * Detection of dependency loops after parsing.
 */
public class DependencyLoopCheckerTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("integration")
    void mutualDependsOnIsALoop() {
        assertThatThrownBy(() -> parse(tempDir, lines(
                "config A",
                "\tbool \"A\"",
                "\tdepends on B",
                "",
                "config B",
                "\tbool \"B\"",
                "\tdepends on A")))
                .isInstanceOf(DependencyLoopException.class)
                .hasMessageStartingWith("Dependency loop")
                .hasMessageContaining("...depends on")
                .hasMessageContaining("...depends again on");
    }

    @Test
    @Tag("integration")
    void selectOfADependencyIsALoopAndNamesTheSelect() {
        assertThatThrownBy(() -> parse(tempDir, lines(
                "config A",
                "\tbool \"A\"",
                "\tdepends on B",
                "\tselect B",
                "",
                "config B",
                "\tbool")))
                .isInstanceOf(DependencyLoopException.class)
                .hasMessageContaining("select-related dependencies");
    }

    @Test
    @Tag("integration")
    void chainWithoutCycleIsAccepted() {
        assertThatCode(() -> parse(tempDir, lines(
                "config A",
                "\tbool \"A\"",
                "",
                "config B",
                "\tbool \"B\"",
                "\tdepends on A",
                "\tselect C",
                "",
                "config C",
                "\tbool",
                "\timply D",
                "",
                "config D",
                "\tbool \"D\"")))
                .doesNotThrowAnyException();
    }
}

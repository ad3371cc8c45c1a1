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
 * Choice modes and selection in bool, tristate and optional choices.
 */
public class ChoiceTest {

    @TempDir
    Path tempDir;

    private static Symbol sym(Kconfig kconfig, String name) {
        return kconfig.getSymbol(name).orElseThrow();
    }

    @Test
    @Tag("unit")
    void tristateChoiceInModuleModeLetsMembersBeModules() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "config MODULES",
                "\tbool \"modules\"",
                "\toption modules",
                "\tdefault y",
                "",
                "choice",
                "\ttristate \"drivers\"",
                "",
                "config A",
                "\ttristate \"a\"",
                "",
                "config B",
                "\ttristate \"b\"",
                "",
                "endchoice"));
        Choice choice = kconfig.getUniqueChoices().get(0);

        assertThat(choice.triValue()).isEqualTo(Tristate.M);
        assertThat(choice.selection()).isNull();
        assertThat(choice.assignable()).containsExactly(Tristate.M, Tristate.Y);

        sym(kconfig, "A").setValue("m");
        sym(kconfig, "B").setValue("m");
        assertThat(sym(kconfig, "A").triValue()).isEqualTo(Tristate.M);
        assertThat(sym(kconfig, "B").triValue()).isEqualTo(Tristate.M);

        choice.setValue(Tristate.Y);
        assertThat(choice.selection()).isSameAs(sym(kconfig, "A"));
        assertThat(sym(kconfig, "B").triValue()).isEqualTo(Tristate.N);
    }

    @Test
    @Tag("unit")
    void bareChoiceRejectsModuleMode() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "choice",
                "\tbool \"pick\"",
                "",
                "config A",
                "\tbool \"a\"",
                "",
                "endchoice"));
        Choice choice = kconfig.getUniqueChoices().get(0);

        assertThat(choice.setValue(Tristate.M)).isEqualTo(AssignmentResult.INVALID_VALUE);
        assertThat(choice.setValue("maybe")).isEqualTo(AssignmentResult.INVALID_VALUE);
        assertThat(choice.triValue()).isEqualTo(Tristate.Y);
    }

    @Test
    @Tag("unit")
    void optionalChoiceStartsOff() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "choice",
                "\tbool \"pick\"",
                "\toptional",
                "",
                "config A",
                "\tbool \"a\"",
                "",
                "config B",
                "\tbool \"b\"",
                "",
                "endchoice"));
        Choice choice = kconfig.getUniqueChoices().get(0);

        assertThat(choice.isOptional()).isTrue();
        assertThat(choice.triValue()).isEqualTo(Tristate.N);
        assertThat(choice.selection()).isNull();
        assertThat(sym(kconfig, "A").triValue()).isEqualTo(Tristate.N);

        sym(kconfig, "B").setValue("y");
        choice.setValue(Tristate.Y);
        assertThat(choice.selection()).isSameAs(sym(kconfig, "B"));
    }

    @Test
    @Tag("unit")
    void conditionalDefaultPicksTheSelection() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "config FAST_HW",
                "\tbool \"fast hardware\"",
                "",
                "choice",
                "\tbool \"mode\"",
                "\tdefault FAST if FAST_HW",
                "\tdefault SAFE",
                "",
                "config SAFE",
                "\tbool \"safe\"",
                "",
                "config FAST",
                "\tbool \"fast\"",
                "",
                "endchoice"));
        Choice choice = kconfig.getUniqueChoices().get(0);

        assertThat(choice.selection()).isSameAs(sym(kconfig, "SAFE"));
        sym(kconfig, "FAST_HW").setValue("y");
        assertThat(choice.selection()).isSameAs(sym(kconfig, "FAST"));
        assertThat(sym(kconfig, "FAST").origin()).isInstanceOf(ValueOrigin.Default.class);
    }

    @Test
    @Tag("unit")
    void invisibleUserSelectionFallsBackOnDefaults() throws Exception {
        Kconfig kconfig = parse(tempDir, lines(
                "config EXTRA",
                "\tbool \"extra\"",
                "",
                "choice",
                "\tbool \"mode\"",
                "",
                "config PLAIN",
                "\tbool \"plain\"",
                "",
                "config FANCY",
                "\tbool \"fancy\"",
                "\tdepends on EXTRA",
                "",
                "endchoice"));
        Choice choice = kconfig.getUniqueChoices().get(0);

        sym(kconfig, "FANCY").setValue("y");
        assertThat(choice.getUserSelection()).isSameAs(sym(kconfig, "FANCY"));
        assertThat(choice.selection()).isSameAs(sym(kconfig, "PLAIN"));

        sym(kconfig, "EXTRA").setValue("y");
        assertThat(choice.selection()).isSameAs(sym(kconfig, "FANCY"));
        assertThat(sym(kconfig, "FANCY").origin()).isInstanceOf(ValueOrigin.Assign.class);
    }
}

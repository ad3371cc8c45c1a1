package org.kconfig4j.model.expr;

import org.kconfig4j.Kconfig;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.Tristate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.kconfig4j.KconfigFixtures.lines;
import static org.kconfig4j.KconfigFixtures.parse;

/**
 * Building, folding, printing and evaluating dependency expressions.
 */
public class ExpressionsTest {

    @TempDir
    Path tempDir;

    private Kconfig kconfig;

    @BeforeEach
    void setUp() throws Exception {
        kconfig = parse(tempDir, lines(
                "config A",
                "\tbool \"a\"",
                "\tdefault y",
                "",
                "config B",
                "\tbool \"b\"",
                "",
                "config C",
                "\tbool \"c\"",
                "\tdepends on A && (B || !A)",
                "",
                "config D",
                "\tbool \"d\"",
                "\tdepends on !(A || B) || S = \"a\\\"b\"",
                "",
                "config S",
                "\tstring \"s\"",
                "\tdefault \"abc\"",
                "",
                "config I",
                "\tint \"i\"",
                "\tdefault 9",
                "",
                "config H",
                "\thex \"h\"",
                "\tdefault 0x20"));
    }

    private Symbol sym(String name) {
        return kconfig.getSymbol(name).orElseThrow();
    }

    @Test
    @Tag("unit")
    void printsWithMinimalParentheses() {
        assertThat(Expressions.format(sym("C").getDirectDep())).isEqualTo("A && (B || !A)");
        assertThat(Expressions.format(sym("D").getDirectDep())).isEqualTo("!(A || B) || S = \"a\\\"b\"");
    }

    @Test
    @Tag("unit")
    void andAndOrFoldConstants() {
        Expr a = sym("A").expr();

        assertThat(Expressions.and(kconfig.y(), a)).isSameAs(a);
        assertThat(Expressions.and(a, kconfig.n())).isSameAs(kconfig.n());
        assertThat(Expressions.or(kconfig.n(), a)).isSameAs(a);
        assertThat(Expressions.or(a, kconfig.y())).isSameAs(kconfig.y());
        assertThat(Expressions.and(a, sym("B").expr())).isInstanceOf(AndExpr.class);
    }

    @Test
    @Tag("unit")
    void splitAndItemsWalkTheTree() {
        Expr dep = sym("C").getDirectDep();

        assertThat(Expressions.split(dep, AndExpr.class)).hasSize(2);
        assertThat(Expressions.split(dep, OrExpr.class)).containsExactly(dep);
        assertThat(Expressions.items(dep)).containsExactly(sym("A"), sym("B"));
    }

    @Test
    @Tag("unit")
    void dependsOnRecognisesAndChainsAndComparisons() {
        assertThat(Expressions.dependsOn(sym("C").getDirectDep(), sym("A"))).isTrue();
        assertThat(Expressions.dependsOn(sym("C").getDirectDep(), sym("B"))).isFalse();
        assertThat(Expressions.dependsOn(sym("D").getDirectDep(), sym("A"))).isFalse();
    }

    @Test
    @Tag("unit")
    void comparisonsAreNumericUnlessBothSidesAreStrings() {
        assertThat(kconfig.evalString("I < 10")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("I > 0x8")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("H >= 32")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("S = \"abc\"")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("S < \"abd\"")).isEqualTo(Tristate.Y);
        assertThat(kconfig.evalString("A != n")).isEqualTo(Tristate.Y);
    }

    @Test
    @Tag("unit")
    void dependenciesDecideVisibility() {
        assertThat(sym("C").visibility()).isEqualTo(Tristate.N);
        sym("B").setValue("y");
        assertThat(sym("C").visibility()).isEqualTo(Tristate.Y);
        assertThat(sym("D").visibility()).isEqualTo(Tristate.N);
    }
}

package org.kconfig4j.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Ordering, parsing and arithmetic of the n/m/y value domain.
 */
public class TristateTest {

    @Test
    @Tag("unit")
    void negationMirrorsAroundM() {
        assertThat(Tristate.N.not()).isEqualTo(Tristate.Y);
        assertThat(Tristate.M.not()).isEqualTo(Tristate.M);
        assertThat(Tristate.Y.not()).isEqualTo(Tristate.N);
    }

    @Test
    @Tag("unit")
    void andIsMinAndOrIsMax() {
        assertThat(Tristate.M.min(Tristate.Y)).isEqualTo(Tristate.M);
        assertThat(Tristate.M.max(Tristate.N)).isEqualTo(Tristate.M);
        assertThat(Tristate.N.max(Tristate.Y)).isEqualTo(Tristate.Y);
    }

    @Test
    @Tag("unit")
    void onlyLowercaseTextParses() {
        assertThat(Tristate.fromText("m")).contains(Tristate.M);
        assertThat(Tristate.fromText("Y")).isEmpty();
        assertThat(Tristate.fromText(null)).isEmpty();
    }
}

package org.kconfig4j.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Escaping and unescaping of string values as they appear in configuration files.
 */
public class StringEscapesTest {

    @Test
    @Tag("unit")
    void escapesBackslashesBeforeQuotes() {
        assertThat(StringEscapes.escape("a\\b\"c")).isEqualTo("a\\\\b\\\"c");
    }

    @Test
    @Tag("unit")
    void unescapeDropsTheBackslashBeforeAnyCharacter() {
        assertThat(StringEscapes.unescape("a\\\\b\\\"c")).isEqualTo("a\\b\"c");
        assertThat(StringEscapes.unescape("\\n\\$")).isEqualTo("n$");
    }
}

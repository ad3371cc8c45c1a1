package org.kconfig4j.serializer;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Parsing of single configuration file lines.
 */
public class ConfigLinesTest {

    private final ConfigLines lines = new ConfigLines("CONFIG_");

    @Test
    @Tag("unit")
    void settingLineKeepsTheRawValue() {
        assertThat(lines.matchSet("CONFIG_NAME=\"a \\\"b\\\"\""))
                .contains(new ConfigLines.Setting("NAME", "\"a \\\"b\\\"\""));
        assertThat(lines.matchSet("CONFIG_EMPTY=")).contains(new ConfigLines.Setting("EMPTY", ""));
        assertThat(lines.matchSet("OTHER_NAME=y")).isEmpty();
    }

    @Test
    @Tag("unit")
    void notSetComment() {
        assertThat(lines.matchUnset("# CONFIG_FOO is not set")).contains("FOO");
        assertThat(lines.matchUnset("# CONFIG_FOO is set")).isEmpty();
        assertThat(lines.matchUnset("#CONFIG_FOO is not set")).isEmpty();
    }

    @Test
    @Tag("unit")
    void prefixIsMatchedLiterally() {
        ConfigLines custom = new ConfigLines("K.");
        assertThat(custom.matchSet("K.A=1")).isPresent();
        assertThat(custom.matchSet("KXA=1")).isEmpty();
    }

    @Test
    @Tag("unit")
    void quotedStringIgnoresTrailingText() {
        assertThat(ConfigLines.matchString("\"x\\\"y\" # comment")).contains("x\\\"y");
        assertThat(ConfigLines.matchString("\"open")).isEmpty();
        assertThat(ConfigLines.matchString("plain")).isEmpty();
    }
}

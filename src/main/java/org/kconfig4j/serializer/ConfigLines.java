package org.kconfig4j.serializer;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the lines of {@code .config} and {@code auto.conf} files.
 */
public final class ConfigLines {

    private static final Pattern STRING_VALUE = Pattern.compile("\"((?:[^\\\\\"]|\\\\.)*)\"");

    private final Pattern setLine;
    private final Pattern unsetLine;

    /**
     * @param prefix The symbol name prefix, normally {@code CONFIG_}.
     */
    public ConfigLines(String prefix) {
        this.setLine = Pattern.compile(Pattern.quote(prefix) + "([^=]+)=(.*)");
        this.unsetLine = Pattern.compile("# " + Pattern.quote(prefix) + "([^ ]+) is not set");
    }

    /**
     * A {@code PREFIX_NAME=value} line. {@code value} is raw: strings keep quotes and escapes.
     */
    public record Setting(String name, String value) {}

    /**
     * Matches {@code PREFIX_NAME=value} at the start of {@code line}.
     */
    public Optional<Setting> matchSet(String line) {
        Matcher m = setLine.matcher(line);
        return m.lookingAt() ? Optional.of(new Setting(m.group(1), m.group(2))) : Optional.empty();
    }

    /**
     * Matches {@code # PREFIX_NAME is not set} and returns the name.
     */
    public Optional<String> matchUnset(String line) {
        Matcher m = unsetLine.matcher(line);
        return m.lookingAt() ? Optional.of(m.group(1)) : Optional.empty();
    }

    /**
     * Extracts the contents of a leading double-quoted string, still escaped. Anything after the
     * closing quote is ignored.
     */
    public static Optional<String> matchString(String value) {
        Matcher m = STRING_VALUE.matcher(value);
        return m.lookingAt() ? Optional.of(m.group(1)) : Optional.empty();
    }
}

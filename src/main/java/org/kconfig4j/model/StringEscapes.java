package org.kconfig4j.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escaping of string values in {@code .config} files and printed Kconfig.
 */
public final class StringEscapes {

    private static final Pattern ESCAPED_CHAR = Pattern.compile("\\\\(.)", Pattern.DOTALL);

    private StringEscapes() {}

    /**
     * Escapes backslashes and double quotes.
     */
    public static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Removes the backslash before any character.
     */
    public static String unescape(String s) {
        Matcher m = ESCAPED_CHAR.matcher(s);
        return m.replaceAll(r -> Matcher.quoteReplacement(r.group(1)));
    }
}

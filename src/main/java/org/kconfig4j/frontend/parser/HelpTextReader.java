package org.kconfig4j.frontend.parser;

import java.util.function.Supplier;

/**
 * Reads the raw lines of a help text. Help texts are not tokenized: the text runs until the first
 * non-blank line indented less than its first line.
 */
final class HelpTextReader {

    private static final int TAB_WIDTH = 8;

    /**
     * @param text      The help text, {@code ""} if it is empty.
     * @param lineAfter The first line after the text, or {@code null} at the end of the file.
     */
    record HelpText(String text, String lineAfter) {}

    private HelpTextReader() {}

    /**
     * @param lines Returns the next physical line, or {@code null} at the end of the file.
     */
    static HelpText read(Supplier<String> lines) {
        String line;
        do {
            line = lines.get();
            if (line == null) {
                return new HelpText("", null);
            }
        } while (line.isBlank());

        String expanded = expandTabs(line);
        int indent = indentation(expanded);
        if (indent == 0) {
            return new HelpText("", line);
        }

        StringBuilder text = new StringBuilder();
        text.append(expanded.substring(indent).stripTrailing()).append('\n');
        while (true) {
            line = lines.get();
            if (line == null) {
                break;
            }
            if (line.isBlank()) {
                text.append('\n');
                continue;
            }
            expanded = expandTabs(line);
            if (indentation(expanded) < indent) {
                break;
            }
            text.append(expanded.substring(indent).stripTrailing()).append('\n');
        }
        return new HelpText(text.toString().stripTrailing(), line);
    }

    static String expandTabs(String line) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                int spaces = TAB_WIDTH - out.length() % TAB_WIDTH;
                out.append(" ".repeat(spaces));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static int indentation(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }
}

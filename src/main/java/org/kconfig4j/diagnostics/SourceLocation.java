package org.kconfig4j.diagnostics;

/**
 * A position in a Kconfig file. The file name is shown relative to the source tree when the
 * file lives under it, and as given otherwise.
 *
 * @param fileName The displayed file name.
 * @param line     The 1-based line number.
 */
public record SourceLocation(String fileName, int line) {

    @Override
    public String toString() {
        return fileName + ":" + line;
    }
}

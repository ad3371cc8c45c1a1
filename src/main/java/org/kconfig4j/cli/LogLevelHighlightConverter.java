package org.kconfig4j.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter that colours the level of console log lines.
 *
 * <p>Kconfig diagnostics are logged as warnings (yellow); fatal errors reported by the commands
 * are bold red. Info lines are cyan so they stand apart from the status lines the commands print
 * to standard output, and debug output about inclusion and file writes is dimmed.
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    static final String RESET = "\u001B[0m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String colour = colourFor(event.getLevel());
        return colour == null ? in : colour + in + RESET;
    }

    /**
     * ANSI prefix for a level, or {@code null} when the level is printed uncoloured.
     */
    static String colourFor(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> "\u001B[1;31m";
            case Level.WARN_INT -> "\u001B[33m";
            case Level.INFO_INT -> "\u001B[36m";
            case Level.DEBUG_INT -> "\u001B[2m";
            default -> null;
        };
    }
}

package org.kconfig4j.serializer;

/**
 * Outcome of writing a configuration file.
 *
 * @param changed Whether the file was written. Files whose content would not change are left alone.
 * @param message E.g. {@code Configuration saved to '.config'}.
 */
public record WriteResult(boolean changed, String message) {}

package org.kconfig4j.host;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * File operations used by {@code source} statements and the configuration writers.
 */
public interface FileSystemAccess {

    /**
     * Expands a glob pattern.
     *
     * @param base    Directory relative patterns are resolved against.
     * @param pattern The pattern, relative or absolute. Without wildcards it matches at most the file itself.
     * @return The matching regular files, sorted by path.
     * @throws IOException If a directory cannot be listed.
     */
    List<Path> glob(Path base, String pattern) throws IOException;

    String readString(Path path) throws IOException;

    boolean exists(Path path);

    /**
     * Writes {@code content} to {@code path}, replacing any previous content and creating missing
     * parent directories.
     */
    void writeString(Path path, String content) throws IOException;

    /**
     * Creates or truncates {@code path}, creating missing parent directories.
     */
    void touch(Path path) throws IOException;

    /**
     * Moves {@code source} over {@code target}, replacing it.
     */
    void move(Path source, Path target) throws IOException;
}

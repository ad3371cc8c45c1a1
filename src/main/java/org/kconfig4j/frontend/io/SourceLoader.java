package org.kconfig4j.frontend.io;

import org.kconfig4j.host.FileSystemAccess;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Centralizes Kconfig file loading: reads through the host's {@link FileSystemAccess} and works out
 * the name a file is shown under in locations and in {@code kconfigFilenames()}.
 */
public final class SourceLoader {

    /**
     * Result of loading a Kconfig file.
     *
     * @param lines       The physical lines, without line terminators.
     * @param logicalName The displayed name: relative to the source tree when the file lives under it.
     */
    public record LoadResult(List<String> lines, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads a file.
     *
     * @param fileSystem The file access to read through.
     * @param path       The path, as found by glob matching.
     * @param srctree    The source tree, or {@code null} when none is set.
     * @return The file's lines and its logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(FileSystemAccess fileSystem, Path path, Path srctree) throws IOException {
        String content = normalizeLineEndings(fileSystem.readString(path));
        return new LoadResult(splitLines(content), logicalName(path, srctree));
    }

    /**
     * @return {@code path} relative to {@code srctree} when it lies inside it, otherwise {@code path}
     *     as is. Separators are always {@code /}.
     */
    public static String logicalName(Path path, Path srctree) {
        Path shown = path;
        if (srctree != null && !srctree.toString().isEmpty() && path.normalize().startsWith(srctree.normalize())) {
            shown = srctree.normalize().relativize(path.normalize());
        }
        return shown.toString().replace('\\', '/');
    }

    /**
     * Splits text into lines. A final newline does not start an extra empty line.
     */
    public static List<String> splitLines(String content) {
        if (content.isEmpty()) {
            return List.of();
        }
        String body = content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
        return Arrays.asList(body.split("\n", -1));
    }

    private static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}

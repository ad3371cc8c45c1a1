package org.kconfig4j.host;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link FileSystemAccess} on the local file system.
 */
public class LocalFileSystemAccess implements FileSystemAccess {

    @Override
    public List<Path> glob(Path base, String pattern) throws IOException {
        Path patternPath = base.resolve(pattern).normalize();
        if (!hasWildcard(pattern)) {
            return Files.isRegularFile(patternPath) ? List.of(patternPath) : List.of();
        }

        // Walk from the deepest directory that has no wildcard in it
        Path root = patternPath.getRoot() != null ? patternPath.getRoot() : Path.of("");
        int depth = 0;
        for (Path part : patternPath) {
            if (hasWildcard(part.toString())) {
                break;
            }
            root = root.resolve(part.toString());
            depth++;
        }
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        int remaining = patternPath.getNameCount() - depth;
        String globText = patternPath.toString().replace("\\", "\\\\");
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globText);

        List<Path> matches = new ArrayList<>();
        Files.walkFileTree(root, java.util.EnumSet.noneOf(java.nio.file.FileVisitOption.class), remaining,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && matcher.matches(file)) {
                            matches.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
        matches.sort(null);
        return matches;
    }

    private static boolean hasWildcard(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0 || text.indexOf('[') >= 0;
    }

    @Override
    public String readString(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path);
    }

    @Override
    public void writeString(Path path, String content) throws IOException {
        createParentDirectories(path);
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    @Override
    public void touch(Path path) throws IOException {
        createParentDirectories(path);
        Files.writeString(path, "", StandardCharsets.UTF_8);
    }

    private static void createParentDirectories(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    @Override
    public void move(Path source, Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
}

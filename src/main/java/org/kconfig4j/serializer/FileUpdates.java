package org.kconfig4j.serializer;

import org.kconfig4j.host.FileSystemAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes that leave a file alone when its content would not change, so that build systems
 * watching modification times see no update.
 */
public final class FileUpdates {

    private static final Logger log = LoggerFactory.getLogger(FileUpdates.class);

    private FileUpdates() {}

    /**
     * @return Whether {@code path} exists and holds exactly {@code contents}.
     */
    public static boolean contentsEqual(FileSystemAccess fs, Path path, String contents) {
        if (!fs.exists(path)) {
            return false;
        }
        try {
            return fs.readString(path).equals(contents);
        } catch (IOException e) {
            // a real problem shows up again when the file is written
            log.debug("Could not read {} for comparison: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * @return Whether the file was written.
     */
    public static boolean writeIfChanged(FileSystemAccess fs, Path path, String contents) throws IOException {
        if (contentsEqual(fs, path, contents)) {
            log.debug("{} is up to date", path);
            return false;
        }
        fs.writeString(path, contents);
        log.debug("Wrote {}", path);
        return true;
    }

    /**
     * Moves {@code path} to {@code path.old}. Failures are ignored: the backup is a convenience,
     * and {@code path} may well be missing or something like {@code /dev/null}.
     */
    public static void saveOld(FileSystemAccess fs, Path path) {
        if (!fs.exists(path)) {
            return;
        }
        Path old = path.resolveSibling(path.getFileName() + ".old");
        try {
            fs.move(path, old);
        } catch (IOException e) {
            log.debug("Could not back up {} to {}: {}", path, old, e.getMessage());
        }
    }
}

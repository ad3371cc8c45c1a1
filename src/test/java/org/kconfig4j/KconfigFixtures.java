package org.kconfig4j;

import org.kconfig4j.frontend.preprocessor.MacroFunctionRegistry;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes Kconfig trees to a temporary source tree and parses them with an isolated environment.
 */
public final class KconfigFixtures {

    private KconfigFixtures() {}

    public static Kconfig parse(Path srctree, String kconfigText) throws IOException {
        return parse(srctree, kconfigText, new MapEnvironment());
    }

    public static Kconfig parse(Path srctree, String kconfigText, MapEnvironment env) throws IOException {
        write(srctree, "Kconfig", kconfigText);
        return open(srctree, env);
    }

    /**
     * Parses {@code srctree/Kconfig}, which the caller has already written.
     */
    public static Kconfig open(Path srctree, MapEnvironment env) throws IOException {
        return open(srctree, HostCapabilities.system().withEnvironment(env));
    }

    public static Kconfig parse(Path srctree, String kconfigText, HostCapabilities host) throws IOException {
        write(srctree, "Kconfig", kconfigText);
        return open(srctree, host);
    }

    public static Kconfig open(Path srctree, HostCapabilities host) throws IOException {
        return new Kconfig(Path.of("Kconfig"), KconfigOptions.defaults().withSrctree(srctree), host,
                MacroFunctionRegistry.initialize());
    }

    public static Path write(Path dir, String relativePath, String content) throws IOException {
        Path file = dir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    public static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }
}

package org.kconfig4j.host;

import java.time.Duration;
import java.util.Objects;

/**
 * The side-effecting capabilities the engine is given by its host.
 *
 * @param environment    Environment variable lookup.
 * @param commandRunner  Runs {@code shell} and toolchain probe commands.
 * @param fileSystem     File access for {@code source} and the writers.
 * @param commandTimeout Timeout applied to every command.
 */
public record HostCapabilities(Environment environment, CommandRunner commandRunner,
                               FileSystemAccess fileSystem, Duration commandTimeout) {

    public HostCapabilities {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(commandRunner, "commandRunner");
        Objects.requireNonNull(fileSystem, "fileSystem");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
    }

    /**
     * @return Capabilities backed by the real process environment, processes and file system.
     */
    public static HostCapabilities system() {
        return new HostCapabilities(new SystemEnvironment(), new ProcessCommandRunner(),
                new LocalFileSystemAccess(), Duration.ofSeconds(60));
    }

    public HostCapabilities withEnvironment(Environment env) {
        return new HostCapabilities(env, commandRunner, fileSystem, commandTimeout);
    }

    public HostCapabilities withCommandRunner(CommandRunner runner) {
        return new HostCapabilities(environment, runner, fileSystem, commandTimeout);
    }

    public HostCapabilities withCommandTimeout(Duration timeout) {
        return new HostCapabilities(environment, commandRunner, fileSystem, timeout);
    }
}

package org.kconfig4j.host;

import java.time.Duration;
import java.util.List;

/**
 * Runs external programs for the {@code shell} and toolchain probe functions.
 * Implementations never throw: a spawn failure or timeout is reported as a failed {@link CommandResult}.
 */
public interface CommandRunner {

    /**
     * Runs a program.
     *
     * @param argv    The program and its arguments. No shell is involved unless {@code argv[0]} is one.
     * @param stdin   Text fed to standard input, or {@code null} for none.
     * @param timeout Maximum run time.
     * @return The result.
     */
    CommandResult run(List<String> argv, String stdin, Duration timeout);
}

package org.kconfig4j.host;

/**
 * Outcome of an external command run through a {@link CommandRunner}.
 *
 * @param exitCode The process exit status, or {@code -1} if the process could not be started or timed out.
 * @param stdout   Everything written to standard output.
 * @param stderr   Everything written to standard error, or the failure reason when the process did not run.
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public static CommandResult failed(String reason) {
        return new CommandResult(-1, "", reason);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}

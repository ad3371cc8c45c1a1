package org.kconfig4j.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.kconfig4j.Kconfig;
import org.kconfig4j.cli.CommandLineInterface;
import org.kconfig4j.diagnostics.KconfigException;

import com.typesafe.config.ConfigException;

import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Base of the subcommands that parse the Kconfig tree and then work on it. Engine and I/O
 * failures are printed as {@code error: ...} and give exit status 1.
 */
abstract class KconfigCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public final Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            Kconfig kconfig = parent.openKconfig();
            int status = run(kconfig, out, err);
            out.flush();
            return status;
        } catch (CommandFailure | KconfigException | IOException | ConfigException | IllegalArgumentException e) {
            out.flush();
            err.println("error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * @return The exit status.
     * @throws CommandFailure For a user-facing error that ends the command.
     */
    protected abstract int run(Kconfig kconfig, PrintWriter out, PrintWriter err) throws IOException;

    protected CommandLineInterface parent() {
        return parent;
    }

    /**
     * Ends a command with an {@code error:} message and exit status 1.
     */
    static final class CommandFailure extends RuntimeException {

        CommandFailure(String message) {
            super(message);
        }
    }
}

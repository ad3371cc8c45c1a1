package org.kconfig4j.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.kconfig4j.Kconfig;
import org.kconfig4j.model.Symbol;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Loads the configuration, applies {@code NAME=value} assignments and writes it back.
 * <p>
 * Each assignment must name a known symbol and must "take": the symbol's resulting value has to
 * equal the assigned one. The first assignment that fails ends the command before anything is
 * written.
 */
@Command(
    name = "setconfig",
    description = "Assign symbol values in the configuration file"
)
public class SetconfigCommand extends KconfigCommand {

    @Option(
        names = {"--no-check-exists"},
        description = "Ignore assignments to symbols that do not exist instead of failing"
    )
    private boolean noCheckExists;

    @Option(
        names = {"--no-check-value"},
        description = "Ignore assignments that did not take, e.g. due to unsatisfied dependencies"
    )
    private boolean noCheckValue;

    @Parameters(paramLabel = "ASSIGNMENT", description = "A NAME=value assignment")
    private List<String> assignments = new ArrayList<>();

    @Override
    protected int run(Kconfig kconfig, PrintWriter out, PrintWriter err) throws IOException {
        out.println(kconfig.loadConfig().message());

        for (String assignment : assignments) {
            int eq = assignment.indexOf('=');
            if (eq < 0) {
                throw new CommandFailure("no '=' in assignment: '" + assignment + "'");
            }
            String name = assignment.substring(0, eq);
            String value = assignment.substring(eq + 1);

            Optional<Symbol> found = kconfig.getSymbol(name);
            if (found.isEmpty()) {
                if (noCheckExists) {
                    continue;
                }
                throw new CommandFailure("no symbol '" + name + "' in configuration");
            }
            Symbol sym = found.get();

            if (!sym.setValue(value).isStored()) {
                throw new CommandFailure("'" + value + "' is an invalid value for the " + sym.getOrigType()
                        + " symbol " + name);
            }
            if (!noCheckValue && !sym.strValue().equals(value)) {
                throw new CommandFailure(name + " was assigned the value '" + value + "', but got the value '"
                        + sym.strValue() + "'. Check the symbol's dependencies, and make sure that it has a prompt.");
            }
        }

        out.println(kconfig.writeConfig().message());
        return 0;
    }
}

package org.kconfig4j.serializer;

import org.kconfig4j.Kconfig;
import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.host.FileSystemAccess;
import org.kconfig4j.model.AssignmentResult;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.DefaultProperty;
import org.kconfig4j.model.Numbers;
import org.kconfig4j.model.StringEscapes;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Tristate;
import org.kconfig4j.model.expr.SymbolExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies {@code .config} files to a {@link Kconfig}.
 * <p>
 * Each {@code PREFIX_NAME=value} and {@code # PREFIX_NAME is not set} line is assigned as a user
 * value, with the same checks as a programmatic assignment. Int and hex values outside a range
 * are retried after the rest of the file has been applied, since the range may depend on symbols
 * assigned further down; values still outside their range are rejected with a RANGE error.
 */
public class ConfigFileReader {

    private static final Logger log = LoggerFactory.getLogger(ConfigFileReader.class);

    private final Kconfig kconfig;
    private final FileSystemAccess fs;
    private final ConfigLines lines;

    /**
     * An int/hex assignment waiting for its range to allow it.
     */
    private record Deferred(Symbol sym, String value, SourceLocation location, int index) {}

    public ConfigFileReader(Kconfig kconfig) {
        this.kconfig = kconfig;
        this.fs = kconfig.getHost().fileSystem();
        this.lines = new ConfigLines(kconfig.getConfigPrefix());
    }

    /**
     * @param path    The file, or {@code null} for the standard configuration file with a fallback
     *                to the {@code defconfig_list} default.
     * @param replace Whether symbols and choices the file does not assign lose their user values.
     * @throws IOException If the file cannot be read.
     */
    public LoadResult load(Path path, boolean replace) throws IOException {
        String msg;
        if (path == null) {
            path = Path.of(kconfig.standardConfigFilename());
            if (resolveExisting(path) == null) {
                Path defconfig = defconfigFilename();
                if (defconfig == null) {
                    return LoadResult.withoutFile("Using default symbol values (no '" + path + "')");
                }
                msg = " default configuration '" + defconfig + "' (no '" + path + "')";
                path = defconfig;
            } else {
                msg = " configuration '" + path + "'";
            }
        } else {
            msg = " configuration '" + path + "'";
        }

        String content = open(path);
        // assignments to prompt-less symbols are normal in configuration files
        kconfig.setWarnAssignNoPrompt(false);
        try {
            List<LoadResult.Assignment> assignments = apply(path, content, replace);
            List<LoadResult.MissingSymbol> missing = assignments.stream()
                    .filter(a -> a.result() == AssignmentResult.UNDEFINED)
                    .map(a -> new LoadResult.MissingSymbol(a.name(), a.value()))
                    .toList();
            log.debug("Applied {} assignments from {}", assignments.size(), path);
            return new LoadResult((replace ? "Loaded" : "Merged") + msg, assignments, missing);
        } finally {
            kconfig.setWarnAssignNoPrompt(true);
        }
    }

    /**
     * Merges the file named by {@code KCONFIG_ALLCONFIG} without override and redundancy warnings.
     *
     * @param defaultName The file to use when the variable is empty or {@code 1}.
     * @return Empty if {@code KCONFIG_ALLCONFIG} is not set.
     */
    public Optional<LoadResult> loadAll(String defaultName) throws IOException {
        Optional<String> allconfig = kconfig.getHost().environment().get("KCONFIG_ALLCONFIG");
        if (allconfig.isEmpty()) {
            return Optional.empty();
        }
        boolean override = kconfig.isWarnAssignOverride();
        boolean redundant = kconfig.isWarnAssignRedundant();
        kconfig.setWarnAssignOverride(false);
        kconfig.setWarnAssignRedundant(false);
        try {
            String name = allconfig.get();
            if (name.isEmpty() || name.equals("1")) {
                try {
                    return Optional.of(load(Path.of(defaultName), false));
                } catch (IOException e1) {
                    try {
                        return Optional.of(load(Path.of("all.config"), false));
                    } catch (IOException e2) {
                        throw new IOException("KCONFIG_ALLCONFIG is set, but neither " + defaultName
                                + " nor all.config could be opened: " + e1.getMessage() + ", " + e2.getMessage(), e2);
                    }
                }
            }
            try {
                return Optional.of(load(Path.of(name), false));
            } catch (IOException e) {
                throw new IOException("KCONFIG_ALLCONFIG is set to '" + name + "', which could not be opened: "
                        + e.getMessage(), e);
            }
        } finally {
            kconfig.setWarnAssignOverride(override);
            kconfig.setWarnAssignRedundant(redundant);
        }
    }

    /**
     * @return The first existing file named by an active default of the {@code option defconfig_list}
     *     symbol, with environment references expanded, or {@code null}.
     */
    public Path defconfigFilename() {
        Symbol list = kconfig.getDefconfigList();
        if (list == null) {
            return null;
        }
        for (DefaultProperty d : list.getDefaults()) {
            if (d.condition().value() == Tristate.N || !(d.value() instanceof SymbolExpr value)) {
                continue;
            }
            Path found = resolveExisting(Path.of(kconfig.expandEnvReferences(value.symbol().strValue())));
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private List<LoadResult.Assignment> apply(Path path, String content, boolean replace) {
        if (replace) {
            kconfig.missingSymbols().clear();
            for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
                sym.setWasSet(false);
            }
            for (Choice choice : kconfig.getUniqueChoices()) {
                choice.setWasSet(false);
            }
        }

        List<LoadResult.Assignment> assignments = new ArrayList<>();
        List<Deferred> deferred = new ArrayList<>();
        String fileName = path.toString();
        int lineNumber = 0;
        for (String rawLine : content.lines().toList()) {
            lineNumber++;
            String line = rawLine.stripTrailing();
            SourceLocation location = new SourceLocation(fileName, lineNumber);

            String name;
            String value;
            Optional<ConfigLines.Setting> setting = lines.matchSet(line);
            if (setting.isPresent()) {
                name = setting.get().name();
                value = setting.get().value();
            } else {
                Optional<String> unset = lines.matchUnset(line);
                if (unset.isEmpty()) {
                    if (!line.isEmpty() && !line.stripLeading().startsWith("#")) {
                        warn("ignoring malformed line '" + line + "'", location);
                    }
                    continue;
                }
                name = unset.get();
                value = null;
            }

            Symbol sym = kconfig.getSymbol(name).filter(Symbol::isDefined).orElse(null);
            if (sym == null) {
                String shown = value != null ? value : "n";
                kconfig.missingSymbols().add(new LoadResult.MissingSymbol(name, shown));
                if (kconfig.isWarnAssignUndefined()) {
                    warn("attempt to assign the value '" + shown + "' to the undefined symbol " + name, location);
                }
                assignments.add(new LoadResult.Assignment(name, shown, AssignmentResult.UNDEFINED, location));
                continue;
            }

            if (value == null) {
                if (!sym.getOrigType().isBoolOrTristate()) {
                    continue;
                }
                value = "n";
            } else {
                value = checkedValue(sym, value, location);
                if (value == null) {
                    continue;
                }
            }

            if (sym.wasSet()) {
                warnAssignedTwice(sym, value, location);
            }

            if (isOutsideRange(sym, value)) {
                // claim the symbol now, so that replacing keeps the previous user value if the retry fails
                sym.setWasSet(true);
                deferred.add(new Deferred(sym, value, location, assignments.size()));
                assignments.add(null);
                continue;
            }
            assignments.add(new LoadResult.Assignment(name, value, sym.setValue(value, location.toString()), location));
        }

        retryDeferred(deferred, assignments);

        if (replace) {
            for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
                if (!sym.wasSet()) {
                    sym.unsetValue();
                }
            }
            for (Choice choice : kconfig.getUniqueChoices()) {
                if (!choice.wasSet()) {
                    choice.unsetValue();
                }
            }
        }
        return assignments;
    }

    /**
     * Checks and normalizes a raw value, and sets the choice mode for choice members.
     *
     * @return The value to assign, or {@code null} if the line is ignored.
     */
    private String checkedValue(Symbol sym, String value, SourceLocation location) {
        SymbolType type = sym.getOrigType();
        if (type.isBoolOrTristate()) {
            // only the first character counts, as in the C tools
            boolean valid = type == SymbolType.BOOL
                    ? value.startsWith("y") || value.startsWith("n")
                    : value.startsWith("y") || value.startsWith("m") || value.startsWith("n");
            if (!valid) {
                warn("'" + value + "' is not a valid value for the " + type + " symbol " + sym.nameAndLocation()
                        + ". Assignment ignored.", location);
                return null;
            }
            String first = value.substring(0, 1);
            Choice choice = sym.getChoice();
            if (choice != null && !first.equals("n")) {
                // the choice mode follows from the values of its members
                Tristate previous = choice.getUserValue();
                if (previous != null && !previous.text().equals(first)) {
                    warn("both m and y assigned to symbols within the same choice", location);
                }
                choice.setValue(first);
            }
            return first;
        }
        if (type == SymbolType.STRING) {
            Optional<String> quoted = ConfigLines.matchString(value);
            if (quoted.isEmpty()) {
                warn("malformed string literal in assignment to " + sym.nameAndLocation() + ". Assignment ignored.",
                        location);
                return null;
            }
            return StringEscapes.unescape(quoted.get());
        }
        return value;
    }

    private static boolean isOutsideRange(Symbol sym, String value) {
        if (!sym.getOrigType().isIntOrHex()) {
            return false;
        }
        Optional<BigInteger> number = Numbers.parse(value, sym.getOrigType().base());
        Optional<Symbol.ActiveRange> range = sym.activeRange();
        return number.isPresent() && range.isPresent() && !range.get().contains(number.get());
    }

    /**
     * Applies deferred int/hex assignments until a pass makes no progress. The remaining ones are
     * assigned anyway, which rejects them with a RANGE error.
     */
    private void retryDeferred(List<Deferred> deferred, List<LoadResult.Assignment> assignments) {
        boolean progress = true;
        while (progress && !deferred.isEmpty()) {
            progress = false;
            for (Deferred d : new ArrayList<>(deferred)) {
                if (!isOutsideRange(d.sym(), d.value())) {
                    assignments.set(d.index(), assign(d));
                    deferred.remove(d);
                    progress = true;
                }
            }
        }
        for (Deferred d : deferred) {
            assignments.set(d.index(), assign(d));
        }
    }

    private static LoadResult.Assignment assign(Deferred d) {
        AssignmentResult result = d.sym().setValue(d.value(), d.location().toString());
        return new LoadResult.Assignment(d.sym().getName(), d.value(), result, d.location());
    }

    private void warnAssignedTwice(Symbol sym, String value, SourceLocation location) {
        String previous = String.valueOf(sym.getUserValue());
        String msg = sym.nameAndLocation() + " set more than once. Old value \"" + previous + "\", new value \""
                + value + "\".";
        if (previous.equals(value)) {
            if (kconfig.isWarnAssignRedundant()) {
                warn(msg, location);
            }
        } else if (kconfig.isWarnAssignOverride()) {
            warn(msg, location);
        }
    }

    /**
     * Reads {@code path}, trying it under the source tree as well when it is relative.
     */
    private String open(Path path) throws IOException {
        try {
            return fs.readString(path);
        } catch (IOException e) {
            Path srctree = kconfig.getSrctree();
            if (srctree != null && !path.isAbsolute()) {
                try {
                    return fs.readString(srctree.resolve(path));
                } catch (IOException e2) {
                    e.addSuppressed(e2);
                }
            }
            throw new IOException("Could not open '" + path + "' (" + e.getMessage() + "). Check that the $srctree "
                    + "environment variable (" + (srctree != null ? "set to '" + srctree + "'" : "unset or blank")
                    + ") is set correctly.", e);
        }
    }

    private Path resolveExisting(Path path) {
        if (fs.exists(path)) {
            return path;
        }
        Path srctree = kconfig.getSrctree();
        if (srctree != null && !path.isAbsolute() && fs.exists(srctree.resolve(path))) {
            return srctree.resolve(path);
        }
        return null;
    }

    private void warn(String message, SourceLocation location) {
        kconfig.getDiagnostics().reportWarning(DiagnosticKind.ASSIGNMENT, message, location);
    }
}

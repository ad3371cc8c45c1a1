package org.kconfig4j.tracker;

import org.kconfig4j.Kconfig;
import org.kconfig4j.host.FileSystemAccess;
import org.kconfig4j.model.StringEscapes;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Tristate;
import org.kconfig4j.serializer.ConfigLines;
import org.kconfig4j.serializer.FileUpdates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maintains per-symbol marker files for incremental builds.
 * <p>
 * The values of the previous run are kept in {@code <dir>/auto.conf}. Every symbol whose written
 * value differs from that record gets its marker {@code <dir>/foo/bar.h} (for {@code FOO_BAR})
 * truncated, which updates its modification time. A missing or {@code n} bool/tristate value
 * counts as the same value. Symbols that disappeared from the Kconfig files are flagged as well.
 */
public class DependencyTracker {

    private static final Logger log = LoggerFactory.getLogger(DependencyTracker.class);

    static final String AUTO_CONF = "auto.conf";

    private final Kconfig kconfig;
    private final FileSystemAccess fs;
    private final ConfigLines lines;

    public DependencyTracker(Kconfig kconfig) {
        this.kconfig = kconfig;
        this.fs = kconfig.getHost().fileSystem();
        this.lines = new ConfigLines(kconfig.getConfigPrefix());
    }

    public void syncDeps(Path dir) throws IOException {
        Map<Symbol, String> oldValues = loadOldValues(dir);

        int touched = 0;
        for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
            String val = sym.strValue();
            String old = oldValues.get(sym);
            if (sym.isWrittenToConfig()) {
                if (old == null && sym.getOrigType().isBoolOrTristate() && val.equals("n")) {
                    continue;
                }
                if (val.equals(old)) {
                    continue;
                }
            } else if (old == null) {
                continue;
            }
            touchMarker(dir, sym.getName());
            touched++;
        }
        log.debug("Flagged {} changed symbols in {}", touched, dir);

        // last, so that a failed run can simply be repeated
        FileUpdates.writeIfChanged(fs, dir.resolve(AUTO_CONF), currentValues());
    }

    private Map<Symbol, String> loadOldValues(Path dir) throws IOException {
        Map<Symbol, String> values = new HashMap<>();
        Path autoConf = dir.resolve(AUTO_CONF);
        if (!fs.exists(autoConf)) {
            return values;
        }
        for (String line : fs.readString(autoConf).lines().toList()) {
            Optional<ConfigLines.Setting> setting = lines.matchSet(line);
            if (setting.isEmpty()) {
                continue;
            }
            String name = setting.get().name();
            String value = setting.get().value();
            Optional<Symbol> sym = kconfig.getSymbol(name).filter(Symbol::isDefined);
            if (sym.isEmpty()) {
                // something may still depend on the removed symbol
                touchMarker(dir, name);
                continue;
            }
            if (sym.get().getOrigType() == SymbolType.STRING) {
                Optional<String> quoted = ConfigLines.matchString(value);
                if (quoted.isEmpty()) {
                    continue;
                }
                value = StringEscapes.unescape(quoted.get());
            }
            values.put(sym.get(), value);
        }
        return values;
    }

    /**
     * @return {@code auto.conf} contents: the written values, without {@code is not set} lines.
     */
    private String currentValues() {
        StringBuilder out = new StringBuilder();
        for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
            if (!(sym.getOrigType().isBoolOrTristate() && sym.triValue() == Tristate.N)) {
                out.append(sym.configString());
            }
        }
        return out.toString();
    }

    /**
     * @return {@code <dir>/foo/bar.h} for {@code FOO_BAR}.
     */
    static Path markerPath(Path dir, String symbolName) {
        return dir.resolve(symbolName.toLowerCase(Locale.ROOT).replace('_', '/') + ".h");
    }

    private void touchMarker(Path dir, String symbolName) throws IOException {
        fs.touch(markerPath(dir, symbolName));
    }
}

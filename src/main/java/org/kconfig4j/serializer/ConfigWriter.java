package org.kconfig4j.serializer;

import org.kconfig4j.Kconfig;
import org.kconfig4j.host.FileSystemAccess;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Tristate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Writes full ({@code .config}) and minimal ({@code defconfig}) configuration files.
 */
public class ConfigWriter {

    private static final Logger log = LoggerFactory.getLogger(ConfigWriter.class);

    private final Kconfig kconfig;
    private final FileSystemAccess fs;

    public ConfigWriter(Kconfig kconfig) {
        this.kconfig = kconfig;
        this.fs = kconfig.getHost().fileSystem();
    }

    /**
     * Writes every symbol that has a value in the current configuration, in menu order, with
     * visible menus and comments as {@code #} comment blocks. The previous file is kept as
     * {@code <path>.old}, but only if a write happens.
     *
     * @param header Text for the top of the file, or {@code null} for the configured header.
     */
    public WriteResult writeConfig(Path path, String header) throws IOException {
        String contents = configContents(header);
        if (FileUpdates.contentsEqual(fs, path, contents)) {
            return new WriteResult(false, "No change to configuration in '" + path + "'");
        }
        FileUpdates.saveOld(fs, path);
        fs.writeString(path, contents);
        log.debug("Wrote configuration to {}", path);
        return new WriteResult(true, "Configuration saved to '" + path + "'");
    }

    /**
     * Writes only the symbols whose values differ from their defaults: reading the file back on top
     * of the defaults gives the current configuration.
     */
    public WriteResult writeMinConfig(Path path, String header) throws IOException {
        if (FileUpdates.writeIfChanged(fs, path, minConfigContents(header))) {
            return new WriteResult(true, "Minimal configuration saved to '" + path + "'");
        }
        return new WriteResult(false, "No change to minimal configuration in '" + path + "'");
    }

    String configContents(String header) {
        StringBuilder out = new StringBuilder(header != null ? header : kconfig.getOptions().configHeader());
        Set<Symbol> written = new HashSet<>();
        MenuNode top = kconfig.getTopNode();
        MenuNode node = top;
        // no blank line after "# end of" when nothing follows in the menu
        boolean afterEndComment = false;

        while (true) {
            if (node.getList() != null) {
                node = node.getList();
            } else if (node.getNext() != null) {
                node = node.getNext();
            } else {
                MenuNode next = null;
                while (node.getParent() != null) {
                    node = node.getParent();
                    if (node.getKind() == NodeKind.MENU && node != top && isShownMenu(node)) {
                        out.append("# end of ").append(node.getPrompt().text()).append('\n');
                        afterEndComment = true;
                    }
                    if (node.getNext() != null) {
                        next = node.getNext();
                        break;
                    }
                }
                if (next == null) {
                    return out.toString();
                }
                node = next;
            }

            Symbol sym = node.getSymbol();
            if (sym != null) {
                if (!written.add(sym)) {
                    continue;
                }
                String line = sym.configString();
                if (line.isEmpty()) {
                    continue;
                }
                if (afterEndComment) {
                    afterEndComment = false;
                    out.append('\n');
                }
                out.append(line);
            } else if (node.getKind() == NodeKind.COMMENT && node.getDep().value() != Tristate.N
                    || node.getKind() == NodeKind.MENU && isShownMenu(node)) {
                out.append("\n#\n# ").append(node.getPrompt().text()).append("\n#\n");
                afterEndComment = false;
            }
        }
    }

    private static boolean isShownMenu(MenuNode node) {
        return node.getDep().value() != Tristate.N && node.getVisibility().value() != Tristate.N;
    }

    String minConfigContents(String header) {
        StringBuilder out = new StringBuilder(header != null ? header : kconfig.getOptions().configHeader());
        for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
            // selects do not affect choice members
            if (sym.getChoice() == null && sym.visibility().compareTo(sym.getRevDep().value()) <= 0) {
                continue;
            }
            if (sym.strValue().equals(sym.defaultValueString())) {
                continue;
            }
            // the member a non-optional bool choice selects by default needs no line
            if (sym.getChoice() != null
                    && !sym.getChoice().isOptional()
                    && sym.getChoice().selectionFromDefaults() == sym
                    && sym.getOrigType() == SymbolType.BOOL
                    && sym.triValue() == Tristate.Y) {
                continue;
            }
            out.append(sym.configString());
        }
        return out.toString();
    }
}

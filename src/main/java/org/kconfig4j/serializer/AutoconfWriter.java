package org.kconfig4j.serializer;

import org.kconfig4j.Kconfig;
import org.kconfig4j.model.StringEscapes;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the configuration as a C header:
 * <pre>
 * #define CONFIG_FOO 1
 * #define CONFIG_BAR_MODULE 1
 * #define CONFIG_NAME "value"
 * #define CONFIG_ADDR 0x1000
 * /&#42; CONFIG_BAZ is not set &#42;/
 * </pre>
 */
public class AutoconfWriter {

    private final Kconfig kconfig;

    public AutoconfWriter(Kconfig kconfig) {
        this.kconfig = kconfig;
    }

    /**
     * @param header Text for the top of the file, or {@code null} for the configured header.
     */
    public WriteResult write(Path path, String header) throws IOException {
        if (FileUpdates.writeIfChanged(kconfig.getHost().fileSystem(), path, contents(header))) {
            return new WriteResult(true, "Kconfig header saved to '" + path + "'");
        }
        return new WriteResult(false, "No change to Kconfig header in '" + path + "'");
    }

    String contents(String header) {
        String prefix = kconfig.getConfigPrefix();
        StringBuilder out = new StringBuilder(header != null ? header : kconfig.getOptions().autoconfHeader());
        for (Symbol sym : kconfig.getUniqueDefinedSymbols()) {
            String val = sym.strValue();
            if (!sym.isWrittenToConfig()) {
                continue;
            }
            String name = prefix + sym.getName();
            SymbolType type = sym.getOrigType();
            if (type.isBoolOrTristate()) {
                switch (val) {
                    case "y" -> out.append("#define ").append(name).append(" 1\n");
                    case "m" -> out.append("#define ").append(name).append("_MODULE 1\n");
                    default -> out.append("/* ").append(name).append(" is not set */\n");
                }
            } else if (type == SymbolType.STRING) {
                out.append("#define ").append(name).append(" \"").append(StringEscapes.escape(val)).append("\"\n");
            } else {
                if (type == SymbolType.HEX && !val.startsWith("0x") && !val.startsWith("0X")) {
                    val = "0x" + val;
                }
                out.append("#define ").append(name).append(' ').append(val).append('\n');
            }
        }
        return out.toString();
    }
}

package org.kconfig4j.frontend.semantics;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigReferenceException;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.Numbers;
import org.kconfig4j.model.Symbol;

/**
 * Reports symbols that are referenced but never defined, together with every place that
 * references them. {@code MODULES} and numbers are exempt.
 */
public class UndefinedSymbolChecker {

    private final DiagnosticsEngine diagnostics;
    private final boolean asError;

    /**
     * @param asError Whether an undefined reference is fatal instead of a warning.
     */
    public UndefinedSymbolChecker(DiagnosticsEngine diagnostics, boolean asError) {
        this.diagnostics = diagnostics;
        this.asError = asError;
    }

    /**
     * @param symbols All non-constant symbols.
     * @param nodes   The menu nodes of the finalized tree.
     * @throws KconfigReferenceException On the first undefined symbol, in error mode.
     */
    public void check(Iterable<Symbol> symbols, Iterable<MenuNode> nodes) {
        for (Symbol sym : symbols) {
            if (sym.isDefined() || sym.isConstant() || isNumber(sym.getName()) || sym.getName().equals("MODULES")) {
                continue;
            }
            StringBuilder msg = new StringBuilder("undefined symbol ").append(sym.getName()).append(':');
            for (MenuNode node : nodes) {
                if (node.referenced().contains(sym)) {
                    msg.append("\n\n- Referenced at ").append(node.getLocation()).append(":\n\n").append(node);
                }
            }
            if (asError) {
                throw new KconfigReferenceException(msg.toString());
            }
            diagnostics.reportWarning(DiagnosticKind.REFERENCE, msg.toString());
        }
    }

    // Unquoted numbers are looked up as ordinary symbols
    private static boolean isNumber(String name) {
        return Numbers.isNumber(name, 10) || Numbers.isNumber(name, 16) && name.toLowerCase().startsWith("0x");
    }
}

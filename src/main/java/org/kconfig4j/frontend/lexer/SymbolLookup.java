package org.kconfig4j.frontend.lexer;

import org.kconfig4j.model.Symbol;

/**
 * Resolves names met while tokenizing to symbols, creating them on first reference.
 */
public interface SymbolLookup {

    /**
     * @return The symbol named {@code name}, created undefined if new.
     */
    Symbol lookupSymbol(String name);

    /**
     * @return The constant symbol for a quoted string or one of {@code n}, {@code m}, {@code y}.
     */
    Symbol lookupConstant(String name);
}

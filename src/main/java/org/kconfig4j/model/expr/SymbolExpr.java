package org.kconfig4j.model.expr;

import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.Tristate;

import java.util.Set;

/**
 * A symbol used as an expression. Obtain instances through {@link Symbol#expr()} so every
 * reference to a symbol shares one leaf.
 */
public record SymbolExpr(Symbol symbol) implements Expr {

    @Override
    public Tristate value() {
        return symbol.triValue();
    }

    @Override
    public void collectItems(Set<ConfigItem> out) {
        out.add(symbol);
    }

    @Override
    public String toString() {
        return Expressions.format(this);
    }
}

package org.kconfig4j.model.expr;

import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.Tristate;

import java.util.Set;

/**
 * A Kconfig expression: a tree of {@code &&}, {@code ||}, {@code !} and comparisons over symbols and choices.
 * Quoted strings and numbers are constant symbols.
 * <p>
 * Expressions are immutable and shared. Several places rely on identity, e.g. a dependency
 * that was AND-ed into a condition is recognised again by reference when printing.
 */
public sealed interface Expr permits AndExpr, OrExpr, NotExpr, CompareExpr, SymbolExpr, ChoiceExpr {

    /**
     * Evaluates the expression against the current symbol values.
     */
    Tristate value();

    /**
     * Adds every symbol and choice the expression references to {@code out}.
     */
    void collectItems(Set<ConfigItem> out);
}

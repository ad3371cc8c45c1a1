package org.kconfig4j.frontend.semantics;

import org.kconfig4j.model.Choice;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.DefaultProperty;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.RangeProperty;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.Expressions;

/**
 * Builds the reverse edges used for cache invalidation: every symbol and choice learns which
 * items read it. The sets err on the large side; expressions are not analysed beyond the items they mention.
 */
public final class DependencyGraphBuilder {

    private DependencyGraphBuilder() {}

    /**
     * Registers the dependents of all defined symbols and choices. Constant and undefined symbols
     * never change value, so only defined items get dependents recorded against them.
     */
    public static void build(Iterable<Symbol> definedSymbols, Iterable<Choice> choices) {
        for (Symbol sym : definedSymbols) {
            for (MenuNode node : sym.getNodes()) {
                if (node.getPrompt() != null) {
                    dependOn(sym, node.getPrompt().condition());
                }
            }
            for (DefaultProperty d : sym.getDefaults()) {
                dependOn(sym, d.value());
                dependOn(sym, d.condition());
            }
            dependOn(sym, sym.getRevDep());
            dependOn(sym, sym.getWeakRevDep());
            for (RangeProperty r : sym.getRanges()) {
                dependOn(sym, r.low().expr());
                dependOn(sym, r.high().expr());
                dependOn(sym, r.condition());
            }
            // needed for 'imply', which only looks at the direct dependencies
            dependOn(sym, sym.getDirectDep());
        }

        for (Choice choice : choices) {
            for (MenuNode node : choice.getNodes()) {
                if (node.getPrompt() != null) {
                    dependOn(choice, node.getPrompt().condition());
                }
            }
            for (DefaultProperty d : choice.getDefaults()) {
                dependOn(choice, d.condition());
            }
        }
    }

    /**
     * Makes each choice depend on its members, whose visibility decides the selection. Added
     * after loop detection, as these edges form harmless member/choice cycles.
     */
    public static void addChoiceDependencies(Iterable<Choice> choices) {
        for (Choice choice : choices) {
            for (Symbol member : choice.getMembers()) {
                member.getDependents().add(choice);
            }
        }
    }

    private static void dependOn(ConfigItem dependent, Expr expr) {
        for (ConfigItem item : Expressions.items(expr)) {
            if (item instanceof Symbol sym && sym.isConstant()) {
                continue;
            }
            item.getDependents().add(dependent);
        }
    }
}

package org.kconfig4j.frontend.semantics;

import org.kconfig4j.diagnostics.DependencyLoopException;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.ResolutionContext;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.expr.Expressions;

import java.util.ArrayList;
import java.util.List;

/**
 * Detects dependency loops with a depth-first search over the dependents graph.
 *
 * <p>Visit states: 0 unvisited, 1 on the current path, 2 known to be outside any loop. Meeting an
 * item in state 1 closes a loop, which is collected while the recursion unwinds back to it.
 * A choice is entered either through one of its members (the other members are then searched)
 * or through a condition that mentions it (all members are searched).</p>
 */
public class DependencyLoopChecker {

    private static final int UNVISITED = 0;
    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    private final ResolutionContext context;

    public DependencyLoopChecker(ResolutionContext context) {
        this.context = context;
    }

    /**
     * @throws DependencyLoopException If any loop exists.
     */
    public void check(Iterable<Symbol> definedSymbols) {
        for (Symbol sym : definedSymbols) {
            checkSymbol(sym, false);
        }
    }

    private List<ConfigItem> checkSymbol(Symbol sym, boolean ignoreChoice) {
        if (sym.getVisitState() == UNVISITED) {
            sym.setVisitState(ON_PATH);

            for (ConfigItem dependent : sym.getDependents()) {
                List<ConfigItem> loop = dependent instanceof Choice choice
                        ? checkChoice(choice, null)
                        : checkSymbol((Symbol) dependent, false);
                if (loop != null) {
                    return foundLoop(loop, sym);
                }
            }

            if (sym.getChoice() != null && !ignoreChoice) {
                List<ConfigItem> loop = checkChoice(sym.getChoice(), sym);
                if (loop != null) {
                    return foundLoop(loop, sym);
                }
            }

            sym.setVisitState(DONE);
            return null;
        }
        if (sym.getVisitState() == DONE) {
            return null;
        }
        List<ConfigItem> loop = new ArrayList<>();
        loop.add(sym);
        return loop;
    }

    private List<ConfigItem> checkChoice(Choice choice, Symbol skip) {
        if (choice.getVisitState() == UNVISITED) {
            choice.setVisitState(ON_PATH);

            for (Symbol member : choice.getMembers()) {
                if (member != skip) {
                    // the choice must not be re-entered through this member
                    List<ConfigItem> loop = checkSymbol(member, true);
                    if (loop != null) {
                        return foundLoop(loop, choice);
                    }
                }
            }

            choice.setVisitState(DONE);
            return null;
        }
        if (choice.getVisitState() == DONE) {
            return null;
        }
        List<ConfigItem> loop = new ArrayList<>();
        loop.add(choice);
        return loop;
    }

    private List<ConfigItem> foundLoop(List<ConfigItem> loop, ConfigItem current) {
        if (current != loop.get(0)) {
            loop.add(current);
            return loop;
        }

        StringBuilder msg = new StringBuilder("Dependency loop\n===============\n\n");
        for (ConfigItem item : loop) {
            if (item != loop.get(0)) {
                msg.append("...depends on ");
                if (item instanceof Symbol sym && sym.getChoice() != null) {
                    msg.append("the choice symbol ");
                }
            }
            msg.append(item.nameAndLocation()).append(", with definition...\n\n").append(item).append("\n\n");

            // select/imply conditions show up as plain dependencies of the target
            if (item instanceof Symbol sym) {
                if (sym.getRevDep() != context.n()) {
                    msg.append("(select-related dependencies: ").append(Expressions.format(sym.getRevDep()))
                            .append(")\n\n");
                }
                if (sym.getWeakRevDep() != context.n()) {
                    msg.append("(imply-related dependencies: ").append(Expressions.format(sym.getWeakRevDep()))
                            .append(")\n\n");
                }
            }
        }
        msg.append("...depends again on ").append(loop.get(0).nameAndLocation());
        throw new DependencyLoopException(msg.toString());
    }
}

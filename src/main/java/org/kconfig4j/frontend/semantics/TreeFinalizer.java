package org.kconfig4j.frontend.semantics;

import org.kconfig4j.model.Choice;
import org.kconfig4j.model.DefaultProperty;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.SelectProperty;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.Expressions;
import org.kconfig4j.model.expr.SymbolExpr;

/**
 * Turns the parsed menu tree into its final shape:
 * <ul>
 *   <li>copies node properties up to symbols and choices and builds reverse dependencies</li>
 *   <li>propagates the dependencies of menus, {@code if}s and choices down to their children</li>
 *   <li>creates implicit submenus under symbols that following symbols depend on</li>
 *   <li>flattens prompt-less nodes and removes {@code if} nodes</li>
 *   <li>registers choice members and settles choice types</li>
 * </ul>
 */
public class TreeFinalizer {

    /**
     * Finalizes {@code node} and everything below it.
     *
     * @param visibleIf The {@code visible if} conditions of enclosing menus, added to prompts.
     */
    public void finalizeNode(MenuNode node, Expr visibleIf) {
        if (node.getKind() == NodeKind.SYMBOL) {
            addPropertiesToSymbol(node);

            // Following nodes that depend on this symbol go in an implicit menu below it
            MenuNode cur = node;
            while (cur.getNext() != null && hasImplicitMenuDependency(node, cur.getNext())) {
                finalizeNode(cur.getNext(), visibleIf);
                cur = cur.getNext();
                cur.setParent(node);
            }
            if (cur != node) {
                node.setList(node.getNext());
                node.setNext(cur.getNext());
                cur.setNext(null);
            }
        } else if (node.getList() != null) {
            if (node.getKind() == NodeKind.MENU) {
                visibleIf = Expressions.and(visibleIf, node.getVisibility());
            }
            // before the recursion, so that implicit menu creation sees the full dependencies
            propagateDependencies(node, visibleIf);
            for (MenuNode cur = node.getList(); cur != null; cur = cur.getNext()) {
                finalizeNode(cur, visibleIf);
            }
        }

        if (node.getList() != null) {
            flatten(node.getList());
            removeIfs(node);
        }

        // empty choices have no list
        if (node.getKind() == NodeKind.CHOICE) {
            Choice choice = node.getChoice();
            choice.setDirectDep(Expressions.or(choice.getDirectDep(), node.getDep()));
            choice.getDefaults().addAll(node.getDefaults());
            finalizeChoice(node);
        }
    }

    private void propagateDependencies(MenuNode node, Expr visibleIf) {
        // The mode of a choice limits the visibility of its members, so the choice itself is the dependency
        Expr baseDep = node.getKind() == NodeKind.CHOICE ? node.getChoice().expr() : node.getDep();

        for (MenuNode cur = node.getList(); cur != null; cur = cur.getNext()) {
            Expr dep = Expressions.and(cur.getDep(), baseDep);
            cur.setDep(dep);

            if (cur.getKind() == NodeKind.SYMBOL || cur.getKind() == NodeKind.CHOICE) {
                if (cur.getPrompt() != null) {
                    cur.setPrompt(cur.getPrompt().withCondition(
                            Expressions.and(cur.getPrompt().condition(), Expressions.and(visibleIf, dep))));
                }
                cur.getDefaults().replaceAll(d -> d.withCondition(Expressions.and(d.condition(), dep)));
                cur.getRanges().replaceAll(r -> r.withCondition(Expressions.and(r.condition(), dep)));
                cur.getSelects().replaceAll(s -> s.withCondition(Expressions.and(s.condition(), dep)));
                cur.getImplies().replaceAll(s -> s.withCondition(Expressions.and(s.condition(), dep)));
            } else if (cur.getPrompt() != null) {
                // 'visible if' only applies to symbols and choices
                cur.setPrompt(cur.getPrompt().withCondition(Expressions.and(cur.getPrompt().condition(), dep)));
            }
        }
    }

    private void addPropertiesToSymbol(MenuNode node) {
        Symbol sym = node.getSymbol();
        sym.setDirectDep(Expressions.or(sym.getDirectDep(), node.getDep()));

        sym.getDefaults().addAll(node.getDefaults());
        sym.getRanges().addAll(node.getRanges());
        sym.getSelects().addAll(node.getSelects());
        sym.getImplies().addAll(node.getImplies());

        for (SelectProperty select : node.getSelects()) {
            Symbol target = select.target();
            target.setRevDep(Expressions.or(target.getRevDep(), Expressions.and(sym.expr(), select.condition())));
        }
        for (SelectProperty imply : node.getImplies()) {
            Symbol target = imply.target();
            target.setWeakRevDep(Expressions.or(target.getWeakRevDep(),
                    Expressions.and(sym.expr(), imply.condition())));
        }
    }

    /**
     * Whether {@code candidate} belongs in an implicit menu rooted at {@code root}: its prompt
     * condition (or its dependency, without a prompt) requires {@code root}'s symbol.
     */
    private static boolean hasImplicitMenuDependency(MenuNode root, MenuNode candidate) {
        Expr dep = candidate.getPrompt() != null ? candidate.getPrompt().condition() : candidate.getDep();
        return Expressions.dependsOn(dep, root.getSymbol());
    }

    /**
     * Moves the children of prompt-less nodes (e.g. {@code if} nodes, invisible symbols with
     * implicit menus) up to follow them. Prompt-less choices keep their members.
     */
    private static void flatten(MenuNode node) {
        while (node != null) {
            if (node.getList() != null && node.getPrompt() == null && node.getKind() != NodeKind.CHOICE) {
                MenuNode last = node.getList();
                while (true) {
                    last.setParent(node.getParent());
                    if (last.getNext() == null) {
                        break;
                    }
                    last = last.getNext();
                }
                last.setNext(node.getNext());
                node.setNext(node.getList());
                node.setList(null);
            }
            node = node.getNext();
        }
    }

    /**
     * Unlinks the (already flattened) {@code if} nodes among the children of {@code node}.
     */
    private static void removeIfs(MenuNode node) {
        MenuNode cur = node.getList();
        while (cur != null && cur.getKind() == NodeKind.IF) {
            cur = cur.getNext();
        }
        node.setList(cur);

        while (cur != null) {
            MenuNode next = cur.getNext();
            while (next != null && next.getKind() == NodeKind.IF) {
                next = next.getNext();
            }
            cur.setNext(next);
            cur = next;
        }
    }

    private static void finalizeChoice(MenuNode node) {
        Choice choice = node.getChoice();
        for (MenuNode cur = node.getList(); cur != null; cur = cur.getNext()) {
            if (cur.getKind() == NodeKind.SYMBOL) {
                cur.getSymbol().setChoice(choice);
                choice.getMembers().add(cur.getSymbol());
            }
        }

        // An untyped choice takes the type of its first typed member
        if (choice.getOrigType() == SymbolType.UNKNOWN) {
            for (Symbol member : choice.getMembers()) {
                if (member.getOrigType() != SymbolType.UNKNOWN) {
                    choice.setOrigType(member.getOrigType());
                    break;
                }
            }
        }
        for (Symbol member : choice.getMembers()) {
            if (member.getOrigType() == SymbolType.UNKNOWN) {
                member.setOrigType(choice.getOrigType());
            }
        }
    }

    /**
     * Gives a type to defined symbols that were declared without one but only have {@code n},
     * {@code m} or {@code y} defaults: tristate if any default is {@code m}, bool otherwise.
     */
    public void inferTypes(Iterable<Symbol> definedSymbols) {
        for (Symbol sym : definedSymbols) {
            if (sym.getOrigType() != SymbolType.UNKNOWN || sym.getDefaults().isEmpty()) {
                continue;
            }
            SymbolType inferred = SymbolType.BOOL;
            for (DefaultProperty d : sym.getDefaults()) {
                String value = constantName(d.value());
                if (value == null) {
                    inferred = null;
                    break;
                }
                if (value.equals("m")) {
                    inferred = SymbolType.TRISTATE;
                }
            }
            if (inferred != null) {
                sym.setOrigType(inferred);
            }
        }
    }

    private static String constantName(Expr expr) {
        if (expr instanceof SymbolExpr s && s.symbol().isConstant()) {
            String name = s.symbol().getName();
            if (name.equals("n") || name.equals("m") || name.equals("y")) {
                return name;
            }
        }
        return null;
    }
}

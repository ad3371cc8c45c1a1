package org.kconfig4j.model.expr;

import org.kconfig4j.model.Choice;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.StringEscapes;
import org.kconfig4j.model.Symbol;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Construction, printing and inspection helpers for {@link Expr} trees.
 */
public final class Expressions {

    private Expressions() {}

    /**
     * Builds {@code a && b}, folding the constants {@code y} and {@code n}.
     */
    public static Expr and(Expr a, Expr b) {
        if (isConstant(a, "y")) {
            return b;
        }
        if (isConstant(b, "y")) {
            return a;
        }
        if (isConstant(a, "n")) {
            return a;
        }
        if (isConstant(b, "n")) {
            return b;
        }
        return new AndExpr(a, b);
    }

    /**
     * Builds {@code a || b}, folding the constants {@code n} and {@code y}.
     */
    public static Expr or(Expr a, Expr b) {
        if (isConstant(a, "n")) {
            return b;
        }
        if (isConstant(b, "n")) {
            return a;
        }
        if (isConstant(a, "y")) {
            return a;
        }
        if (isConstant(b, "y")) {
            return b;
        }
        return new OrExpr(a, b);
    }

    /**
     * @return Whether {@code expr} is the constant symbol named {@code name}.
     */
    public static boolean isConstant(Expr expr, String name) {
        return expr instanceof SymbolExpr s && s.symbol().isConstant() && s.symbol().getName().equals(name);
    }

    public static String format(Expr expr) {
        return format(expr, Expressions::standardItemString);
    }

    /**
     * Prints an expression in Kconfig syntax. An OR operand of an AND is parenthesised and
     * vice versa; a negated compound operand is parenthesised.
     *
     * @param expr          The expression.
     * @param itemFormatter Prints each symbol or choice leaf.
     */
    public static String format(Expr expr, Function<ConfigItem, String> itemFormatter) {
        if (expr instanceof SymbolExpr s) {
            return itemFormatter.apply(s.symbol());
        }
        if (expr instanceof ChoiceExpr c) {
            return itemFormatter.apply(c.choice());
        }
        if (expr instanceof AndExpr and) {
            return parenthesize(and.left(), OrExpr.class, itemFormatter) + " && "
                    + parenthesize(and.right(), OrExpr.class, itemFormatter);
        }
        if (expr instanceof OrExpr or) {
            return parenthesize(or.left(), AndExpr.class, itemFormatter) + " || "
                    + parenthesize(or.right(), AndExpr.class, itemFormatter);
        }
        if (expr instanceof NotExpr not) {
            if (not.operand() instanceof SymbolExpr || not.operand() instanceof ChoiceExpr) {
                return "!" + format(not.operand(), itemFormatter);
            }
            return "!(" + format(not.operand(), itemFormatter) + ")";
        }
        CompareExpr cmp = (CompareExpr) expr;
        return itemFormatter.apply(cmp.left()) + " " + cmp.relation().operator() + " "
                + itemFormatter.apply(cmp.right());
    }

    private static String parenthesize(Expr expr, Class<? extends Expr> kind, Function<ConfigItem, String> fmt) {
        String text = format(expr, fmt);
        return kind.isInstance(expr) ? "(" + text + ")" : text;
    }

    /**
     * Default leaf printer: symbol names as is, constant strings quoted and escaped
     * (except {@code n}/{@code m}/{@code y}), choices as {@code <choice NAME>}.
     */
    public static String standardItemString(ConfigItem item) {
        if (item instanceof Symbol sym) {
            String name = sym.getName();
            if (sym.isConstant() && !(name.equals("n") || name.equals("m") || name.equals("y"))) {
                return "\"" + StringEscapes.escape(name) + "\"";
            }
            return name;
        }
        Choice choice = (Choice) item;
        return choice.getName() != null ? "<choice " + choice.getName() + ">" : "<choice>";
    }

    /**
     * Splits a chain of {@code kind} operators into its operands, e.g. {@code A && (B || C) && D}
     * split on AND gives {@code [A, B || C, D]}.
     */
    public static List<Expr> split(Expr expr, Class<? extends Expr> kind) {
        List<Expr> out = new ArrayList<>();
        splitInto(expr, kind, out);
        return out;
    }

    private static void splitInto(Expr expr, Class<? extends Expr> kind, List<Expr> out) {
        if (kind == AndExpr.class && expr instanceof AndExpr and) {
            splitInto(and.left(), kind, out);
            splitInto(and.right(), kind, out);
        } else if (kind == OrExpr.class && expr instanceof OrExpr or) {
            splitInto(or.left(), kind, out);
            splitInto(or.right(), kind, out);
        } else {
            out.add(expr);
        }
    }

    /**
     * @return The symbols and choices referenced in {@code expr}, in first-reference order.
     */
    public static Set<ConfigItem> items(Expr expr) {
        Set<ConfigItem> out = new LinkedHashSet<>();
        expr.collectItems(out);
        return out;
    }

    /**
     * Whether {@code expr} makes a node depend on {@code sym} for implicit submenu creation:
     * {@code sym}, {@code sym=m}, {@code sym=y}, {@code sym!=n}, or an AND chain containing one of these.
     */
    public static boolean dependsOn(Expr expr, Symbol sym) {
        if (expr instanceof SymbolExpr s) {
            return s.symbol() == sym;
        }
        if (expr instanceof CompareExpr cmp
                && (cmp.relation() == Relation.EQUAL || cmp.relation() == Relation.UNEQUAL)) {
            Symbol other;
            if (cmp.right() == sym) {
                other = cmp.left();
            } else if (cmp.left() == sym) {
                other = cmp.right();
            } else {
                return false;
            }
            if (!other.isConstant()) {
                return false;
            }
            String value = other.getName();
            return cmp.relation() == Relation.EQUAL ? value.equals("m") || value.equals("y") : value.equals("n");
        }
        if (expr instanceof AndExpr and) {
            return dependsOn(and.left(), sym) || dependsOn(and.right(), sym);
        }
        return false;
    }
}

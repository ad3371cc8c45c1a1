package org.kconfig4j.frontend.semantics;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigSyntaxException;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.DefaultProperty;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.RangeProperty;
import org.kconfig4j.model.ResolutionContext;
import org.kconfig4j.model.SelectProperty;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Numbers;
import org.kconfig4j.model.expr.AndExpr;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.Expressions;
import org.kconfig4j.model.expr.OrExpr;
import org.kconfig4j.model.expr.SymbolExpr;

/**
 * Checks symbol and choice properties after the tree has been finalized. Mostly produces
 * warnings; malformed defaults and unparsable quoted numbers are fatal.
 */
public class SanityChecker {

    private final ResolutionContext context;
    private final DiagnosticsEngine diagnostics;

    public SanityChecker(ResolutionContext context) {
        this.context = context;
        this.diagnostics = context.getDiagnostics();
    }

    public void checkSymbols(Iterable<Symbol> definedSymbols) {
        for (Symbol sym : definedSymbols) {
            SymbolType type = sym.getOrigType();
            if (type.isBoolOrTristate()) {
                checkSelectTargets(sym, "selects", sym.getSelects());
                checkSelectTargets(sym, "implies", sym.getImplies());
            } else if (type != SymbolType.UNKNOWN) {
                for (DefaultProperty d : sym.getDefaults()) {
                    checkScalarDefault(sym, d);
                }
                if (!sym.getSelects().isEmpty() || !sym.getImplies().isEmpty()) {
                    warn("the " + type + " symbol " + sym.nameAndLocation() + " has selects or implies");
                }
            } else {
                warn(sym.nameAndLocation() + " defined without a type");
            }

            if (!sym.getRanges().isEmpty()) {
                if (!type.isIntOrHex()) {
                    warn("the " + type + " symbol " + sym.nameAndLocation() + " has ranges, but is not int or hex");
                } else {
                    for (RangeProperty r : sym.getRanges()) {
                        if (!isNumberFor(sym, r.low()) || !isNumberFor(sym, r.high())) {
                            warn("the " + type + " symbol " + sym.nameAndLocation() + " has a non-" + type
                                    + " range [" + r.low().nameAndLocation() + ", " + r.high().nameAndLocation() + "]");
                        }
                    }
                }
            }
        }
    }

    private void checkSelectTargets(Symbol sym, String verb, Iterable<SelectProperty> props) {
        for (SelectProperty p : props) {
            SymbolType targetType = p.target().getOrigType();
            if (!targetType.isBoolOrTristate() && targetType != SymbolType.UNKNOWN) {
                warn(sym.nameAndLocation() + " " + verb + " the " + targetType + " symbol "
                        + p.target().nameAndLocation() + ", which is not bool or tristate");
            }
        }
    }

    private void checkScalarDefault(Symbol sym, DefaultProperty d) {
        SymbolType type = sym.getOrigType();
        if (!(d.value() instanceof SymbolExpr valueExpr)) {
            throw new KconfigSyntaxException(d.location(), "the " + type + " symbol " + sym.nameAndLocation()
                    + " has a malformed default " + Expressions.format(d.value()) + " -- expected a single symbol");
        }
        Symbol value = valueExpr.symbol();
        if (type == SymbolType.STRING) {
            // 'default foo' is either a symbol reference or a string missing its quotes
            if (!value.isConstant() && value.getNodes().isEmpty() && !isUpperCase(value.getName())) {
                warn("style: quotes recommended around default value for string symbol " + sym.nameAndLocation());
            }
        } else if (!isNumberFor(sym, value)) {
            warn("the " + type + " symbol " + sym.nameAndLocation() + " has a non-" + type + " default "
                    + value.nameAndLocation());
        }
    }

    /**
     * Whether {@code sym} can stand for a value of an int or hex symbol: a number for constants and
     * undefined names, a symbol of the same type otherwise. A quoted literal that is not a number
     * is fatal.
     */
    private boolean isNumberFor(Symbol owner, Symbol sym) {
        SymbolType type = owner.getOrigType();
        if (!sym.getNodes().isEmpty()) {
            return sym.getOrigType() == type;
        }
        boolean number = Numbers.isNumber(sym.getName(), type.base());
        if (!number && sym.isConstant() && !isTristateConstant(sym)) {
            throw new KconfigSyntaxException("error: the " + type + " symbol " + owner.nameAndLocation()
                    + " uses the malformed " + type + " literal \"" + sym.getName() + "\"");
        }
        return number;
    }

    public void checkChoices(Iterable<Choice> choices) {
        for (Choice choice : choices) {
            if (!choice.getOrigType().isBoolOrTristate()) {
                warn(choice.nameAndLocation() + " defined with type " + choice.getOrigType());
            }

            if (choice.getNodes().stream().noneMatch(n -> n.getPrompt() != null)) {
                warn(choice.nameAndLocation() + " defined without a prompt");
            }

            for (DefaultProperty d : choice.getDefaults()) {
                if (!(d.value() instanceof SymbolExpr target)) {
                    throw new KconfigSyntaxException(d.location(), choice.nameAndLocation()
                            + " has a malformed default " + Expressions.format(d.value()));
                }
                if (target.symbol().getChoice() != choice) {
                    warn("the default selection " + target.symbol().nameAndLocation() + " of "
                            + choice.nameAndLocation() + " is not contained in the choice");
                }
            }

            for (Symbol member : choice.getMembers()) {
                if (!member.getDefaults().isEmpty()) {
                    warn("default on the choice symbol " + member.nameAndLocation() + " will have no effect, "
                            + "as defaults do not affect choice symbols");
                }
                if (member.getRevDep() != context.n()) {
                    warnSelectImply(member, member.getRevDep(), "selected");
                }
                if (member.getWeakRevDep() != context.n()) {
                    warnSelectImply(member, member.getWeakRevDep(), "implied");
                }
                for (MenuNode node : member.getNodes()) {
                    if (node.getParent() != null && node.getParent().getItem() == choice) {
                        if (node.getPrompt() == null) {
                            warn("the choice symbol " + member.nameAndLocation() + " has no prompt");
                        }
                    } else if (node.getPrompt() != null) {
                        warn("the choice symbol " + member.nameAndLocation()
                                + " is defined with a prompt outside the choice");
                    }
                }
            }
        }
    }

    private void warnSelectImply(Symbol sym, Expr reverseDep, String how) {
        StringBuilder msg = new StringBuilder("the choice symbol " + sym.nameAndLocation() + " is " + how
                + " by the following symbols, but select/imply has no effect on choice symbols");
        for (Expr term : Expressions.split(reverseDep, OrExpr.class)) {
            Expr selector = Expressions.split(term, AndExpr.class).get(0);
            if (selector instanceof SymbolExpr s) {
                msg.append("\n - ").append(s.symbol().nameAndLocation());
            }
        }
        warn(msg.toString());
    }

    private void warn(String message) {
        diagnostics.reportWarning(DiagnosticKind.GENERAL, message);
    }

    private static boolean isTristateConstant(Symbol sym) {
        String name = sym.getName();
        return name.equals("n") || name.equals("m") || name.equals("y");
    }

    private static boolean isUpperCase(String name) {
        return name.chars().anyMatch(Character::isLetter) && name.equals(name.toUpperCase());
    }
}

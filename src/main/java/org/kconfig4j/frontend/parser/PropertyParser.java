package org.kconfig4j.frontend.parser;

import org.kconfig4j.Kconfig;
import org.kconfig4j.frontend.lexer.Token;
import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.DefaultProperty;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.PromptProperty;
import org.kconfig4j.model.RangeProperty;
import org.kconfig4j.model.SelectProperty;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.model.expr.Expressions;
import org.kconfig4j.model.expr.NotExpr;
import org.kconfig4j.model.expr.OrExpr;

import java.util.Optional;

/**
 * Parses the property lines that follow a {@code config}, {@code choice}, {@code menu} or
 * {@code comment} statement. Properties are stored on the {@link MenuNode} of that definition and
 * copied to the symbol or choice when the tree is finalized, so that each definition location
 * keeps its own properties.
 * <p>
 * Parsing stops at the first line that is not a property; that line is handed back to the
 * enclosing block.
 */
class PropertyParser {

    private final ParsingContext context;

    PropertyParser(ParsingContext context) {
        this.context = context;
    }

    void parse(MenuNode node) {
        Kconfig kconfig = context.getKconfig();
        node.setDep(kconfig.y());

        while (context.nextLine()) {
            Token first = context.keyword();
            if (first == null) {
                continue;
            }

            switch (first.type()) {
                case BOOL:
                case TRISTATE:
                case STRING:
                case INT:
                case HEX:
                    setType(node, typeOf(first.type()));
                    if (!context.isAtEnd()) {
                        parsePrompt(node);
                    }
                    break;

                case DEPENDS:
                    if (!context.match(TokenType.ON)) {
                        throw context.error("expected 'on' after 'depends'");
                    }
                    node.setDep(Expressions.and(node.getDep(), parseDependency()));
                    break;

                case HELP:
                    String owner = ownerName(node);
                    if (node.getHelp() != null) {
                        context.warn(owner + " defined with more than one help text -- only the last one will be used");
                    }
                    node.setHelp(context.readHelpText(owner));
                    break;

                case SELECT:
                    requireSymbol(node, "only symbols can select");
                    node.getSelects().add(new SelectProperty(context.expectNonConstantSymbol(), context.parseCondition()));
                    break;

                case IMPLY:
                    requireSymbol(node, "only symbols can imply");
                    node.getImplies().add(new SelectProperty(context.expectNonConstantSymbol(), context.parseCondition()));
                    break;

                case DEFAULT:
                    addDefault(node);
                    break;

                case DEF_BOOL:
                case DEF_TRISTATE:
                case DEF_STRING:
                case DEF_INT:
                case DEF_HEX:
                    setType(node, typeOf(first.type()));
                    addDefault(node);
                    break;

                case PROMPT:
                    parsePrompt(node);
                    break;

                case RANGE:
                    node.getRanges().add(new RangeProperty(context.expectSymbol(), context.expectSymbol(),
                            context.parseCondition()));
                    break;

                case VISIBLE:
                    if (!context.match(TokenType.IF)) {
                        throw context.error("expected 'if' after 'visible'");
                    }
                    node.setVisibility(Expressions.and(node.getVisibility(), context.expectExpressionAndEol()));
                    break;

                case OPTION:
                    parseOption(node);
                    break;

                case OPTIONAL:
                    if (!(node.getItem() instanceof Choice choice)) {
                        throw context.error("\"optional\" is only valid for choices");
                    }
                    choice.setOptional(true);
                    break;

                case MODULES:
                    setModules(node);
                    break;

                case TRANSITIONAL:
                    requireSymbol(node, "the 'transitional' property is only valid for symbols").setTransitional(true);
                    context.expectEol();
                    break;

                default:
                    context.reuseLine();
                    return;
            }
        }
    }

    /**
     * Parses the rest of a {@code depends on} line. {@code depends on A if B} only applies the
     * dependency when {@code B} holds, and is stored as {@code !B || A}.
     */
    private Expr parseDependency() {
        Expr dep = context.parseExpression(true);
        if (context.match(TokenType.IF)) {
            Expr condition = context.parseExpression(true);
            dep = new OrExpr(new NotExpr(condition), dep);
        }
        context.expectEol();
        return dep;
    }

    private void addDefault(MenuNode node) {
        Expr value = context.parseExpression(false);
        node.getDefaults().add(new DefaultProperty(value, context.parseCondition(), context.getLocation()));
    }

    private void parsePrompt(MenuNode node) {
        if (node.getPrompt() != null) {
            context.warn(ownerName(node) + " defined with multiple prompts in single location");
        }
        Token token = context.advance();
        if (token == null || !token.is(TokenType.TEXT)) {
            throw context.error("expected prompt string");
        }
        String prompt = token.text();
        if (!prompt.equals(prompt.strip())) {
            context.warn(ownerName(node) + " has leading or trailing whitespace in its prompt");
            prompt = prompt.strip();
        }
        node.setPrompt(new PromptProperty(prompt, context.parseCondition()));
    }

    private void parseOption(MenuNode node) {
        Kconfig kconfig = context.getKconfig();
        if (context.match(TokenType.ENV)) {
            if (!context.match(TokenType.EQUAL)) {
                throw context.error("expected '=' after 'env'");
            }
            Symbol sym = requireSymbol(node, "the 'env' option is only valid for symbols");
            String envVar = context.expectTextAndEol();
            sym.setEnvVar(envVar);
            kconfig.recordEnvVar(envVar);

            Optional<String> value = kconfig.getHost().environment().get(envVar);
            if (value.isPresent()) {
                node.getDefaults().add(new DefaultProperty(context.getSymbols().lookupConstant(value.get()).expr(),
                        kconfig.y(), context.getLocation()));
            } else {
                context.warnHere(sym.getName() + " has 'option env=\"" + envVar + "\"', but the environment variable "
                        + envVar + " is not set");
            }
            if (!envVar.equals(sym.getName())) {
                context.warnHere("environment variables are expanded directly in strings, so 'option env=...' "
                        + "\"bounce\" symbols are not needed. For compatibility with the C tools, rename "
                        + sym.getName() + " to " + envVar + " (so that the symbol name matches the environment "
                        + "variable name).");
            }
        } else if (context.match(TokenType.DEFCONFIG_LIST)) {
            Symbol sym = requireSymbol(node, "the 'defconfig_list' option is only valid for symbols");
            Symbol existing = kconfig.getDefconfigList();
            if (existing == null) {
                kconfig.setDefconfigList(sym);
            } else if (existing != sym) {
                context.warnHere("'option defconfig_list' set on multiple symbols (" + existing.getName() + " and "
                        + sym.getName() + "). Only " + existing.getName() + " will be used.");
            }
        } else if (context.match(TokenType.MODULES)) {
            setModules(node);
        } else if (context.match(TokenType.ALLNOCONFIG_Y)) {
            requireSymbol(node, "the 'allnoconfig_y' option is only valid for symbols").setAllnoconfigY(true);
        } else {
            throw context.error("unrecognized option");
        }
    }

    private void setModules(MenuNode node) {
        Symbol sym = requireSymbol(node, "the 'modules' option is only valid for symbols");
        context.getKconfig().setModules(sym);
    }

    private void setType(MenuNode node, SymbolType type) {
        ConfigItem item = node.getItem();
        if (item == null) {
            throw context.error("only symbols and choices have a type");
        }
        if (item.getOrigType() != SymbolType.UNKNOWN && item.getOrigType() != type) {
            context.warn(item.nameAndLocation() + " defined with multiple types, " + type + " will be used");
        }
        item.setOrigType(type);
    }

    private Symbol requireSymbol(MenuNode node, String message) {
        if (!(node.getItem() instanceof Symbol sym)) {
            throw context.error(message);
        }
        return sym;
    }

    private static String ownerName(MenuNode node) {
        if (node.getItem() != null) {
            return node.getItem().nameAndLocation();
        }
        String text = node.getPrompt() != null ? " \"" + node.getPrompt().text() + "\"" : "";
        return node.getKind().name().toLowerCase() + text + " (defined at " + node.getLocation() + ")";
    }

    private static SymbolType typeOf(TokenType token) {
        switch (token) {
            case BOOL:
            case DEF_BOOL:
                return SymbolType.BOOL;
            case TRISTATE:
            case DEF_TRISTATE:
                return SymbolType.TRISTATE;
            case STRING:
            case DEF_STRING:
                return SymbolType.STRING;
            case INT:
            case DEF_INT:
                return SymbolType.INT;
            default:
                return SymbolType.HEX;
        }
    }
}

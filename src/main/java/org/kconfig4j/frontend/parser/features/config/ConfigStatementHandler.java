package org.kconfig4j.frontend.parser.features.config;

import org.kconfig4j.frontend.lexer.Token;
import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.Symbol;

/**
 * Handler for the {@code config} and {@code menuconfig} statements.
 * Each occurrence adds a definition location (a new {@link MenuNode}) to the symbol.
 */
public class ConfigStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        Token name = context.advance();
        if (name == null || !name.is(TokenType.SYMBOL) || name.symbol().isConstant()) {
            throw context.error("missing or bad symbol name");
        }
        context.expectEol();

        Symbol sym = name.symbol();
        context.getSymbols().addDefinition(sym);

        MenuNode node = context.newNode(NodeKind.SYMBOL, sym, parent);
        node.setMenuconfig(keyword == TokenType.MENUCONFIG);
        sym.getNodes().add(node);

        context.parseProperties(node);

        if (node.isMenuconfig() && node.getPrompt() == null) {
            context.warn("the menuconfig symbol " + sym.nameAndLocation() + " has no prompt");
        }

        prev.setNext(node);
        return node;
    }
}

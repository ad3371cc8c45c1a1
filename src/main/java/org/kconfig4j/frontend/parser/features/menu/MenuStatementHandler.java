package org.kconfig4j.frontend.parser.features.menu;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.PromptProperty;

/**
 * Handler for {@code menu "Title" ... endmenu}.
 */
public class MenuStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        MenuNode node = context.newNode(NodeKind.MENU, null, parent);
        node.setMenuconfig(true);
        node.setPrompt(new PromptProperty(context.expectTextAndEol(), context.getKconfig().y()));
        context.getSymbols().addMenu(node);

        context.parseProperties(node);
        context.parseBlock(TokenType.ENDMENU, node, node);
        node.setList(node.getNext());

        prev.setNext(node);
        return node;
    }
}

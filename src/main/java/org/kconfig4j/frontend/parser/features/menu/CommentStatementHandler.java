package org.kconfig4j.frontend.parser.features.menu;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.PromptProperty;

/**
 * Handler for {@code comment "Text"}. Comments take {@code depends on} like menus do.
 */
public class CommentStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        MenuNode node = context.newNode(NodeKind.COMMENT, null, parent);
        node.setPrompt(new PromptProperty(context.expectTextAndEol(), context.getKconfig().y()));
        context.getSymbols().addComment(node);

        context.parseProperties(node);

        prev.setNext(node);
        return node;
    }
}

package org.kconfig4j.frontend.parser.features.choice;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;

/**
 * Handler for {@code choice ... endchoice}. The {@code config} statements inside become the
 * choice's members when the tree is finalized.
 */
public class ChoiceStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        String name = context.isAtEnd() ? null : context.expectTextAndEol();
        Choice choice = context.getSymbols().choiceFor(name);

        MenuNode node = context.newNode(NodeKind.CHOICE, choice, parent);
        node.setMenuconfig(true);
        choice.getNodes().add(node);

        context.parseProperties(node);
        context.parseBlock(TokenType.ENDCHOICE, node, node);
        node.setList(node.getNext());

        prev.setNext(node);
        return node;
    }
}

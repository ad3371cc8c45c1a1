package org.kconfig4j.frontend.parser.features.conditional;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;

/**
 * Handler for {@code if <expr> ... endif}. The node only carries the condition; it is removed
 * when the tree is finalized, after its condition has been added to everything inside.
 */
public class IfStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        MenuNode node = context.newNode(NodeKind.IF, null, parent);
        node.setDep(context.expectExpressionAndEol());

        context.parseBlock(TokenType.ENDIF, node, node);
        node.setList(node.getNext());

        prev.setNext(node);
        return node;
    }
}

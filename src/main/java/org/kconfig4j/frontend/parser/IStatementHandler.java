package org.kconfig4j.frontend.parser;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.model.MenuNode;

/**
 * Interface for handlers that parse one kind of Kconfig statement.
 */
public interface IStatementHandler {

    /**
     * Parses a statement whose keyword has already been consumed.
     * @param context The parsing context.
     * @param keyword The statement keyword.
     * @param parent  The enclosing menu, choice or {@code if} node.
     * @param prev    The node the new node is linked after.
     * @return The node later statements are linked after.
     */
    MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev);
}

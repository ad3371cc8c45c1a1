package org.kconfig4j.frontend.parser.features.source;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.MenuNode;

/**
 * Handler for {@code source}, {@code rsource}, {@code osource} and {@code orsource}.
 * The {@code r} variants resolve the pattern against the including file's directory; the
 * {@code o} variants accept a pattern that matches nothing.
 */
public class SourceStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        String pattern = context.expectTextAndEol();
        return context.includeFiles(keyword, pattern, parent, prev);
    }
}

package org.kconfig4j.frontend.parser.features.mainmenu;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.IStatementHandler;
import org.kconfig4j.frontend.parser.ParsingContext;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.PromptProperty;

/**
 * Handler for {@code mainmenu "Title"}, which sets the prompt of the top node.
 */
public class MainmenuStatementHandler implements IStatementHandler {

    @Override
    public MenuNode parse(ParsingContext context, TokenType keyword, MenuNode parent, MenuNode prev) {
        String title = context.expectTextAndEol();
        context.getKconfig().getTopNode().setPrompt(new PromptProperty(title, context.getKconfig().y()));
        return prev;
    }
}

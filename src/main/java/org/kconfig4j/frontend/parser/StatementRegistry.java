package org.kconfig4j.frontend.parser;

import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.parser.features.choice.ChoiceStatementHandler;
import org.kconfig4j.frontend.parser.features.conditional.IfStatementHandler;
import org.kconfig4j.frontend.parser.features.config.ConfigStatementHandler;
import org.kconfig4j.frontend.parser.features.mainmenu.MainmenuStatementHandler;
import org.kconfig4j.frontend.parser.features.menu.CommentStatementHandler;
import org.kconfig4j.frontend.parser.features.menu.MenuStatementHandler;
import org.kconfig4j.frontend.parser.features.source.SourceStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for statement handlers.
 * Maps statement keywords (e.g. {@code config}, {@code menu}) to their handlers.
 */
public class StatementRegistry {

    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a statement keyword.
     * @param keyword The keyword.
     * @param handler The handler for this statement.
     */
    public void register(TokenType keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a statement keyword.
     * @param keyword The keyword.
     * @return The handler, or empty if the keyword does not start a statement.
     */
    public Optional<IStatementHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Creates a registry with all built-in statement handlers.
     * @return A new registry instance.
     */
    public static StatementRegistry initialize() {
        StatementRegistry registry = new StatementRegistry();
        ConfigStatementHandler config = new ConfigStatementHandler();
        registry.register(TokenType.CONFIG, config);
        registry.register(TokenType.MENUCONFIG, config);
        SourceStatementHandler source = new SourceStatementHandler();
        registry.register(TokenType.SOURCE, source);
        registry.register(TokenType.RSOURCE, source);
        registry.register(TokenType.OSOURCE, source);
        registry.register(TokenType.ORSOURCE, source);
        registry.register(TokenType.IF, new IfStatementHandler());
        registry.register(TokenType.MENU, new MenuStatementHandler());
        registry.register(TokenType.COMMENT, new CommentStatementHandler());
        registry.register(TokenType.CHOICE, new ChoiceStatementHandler());
        registry.register(TokenType.MAINMENU, new MainmenuStatementHandler());
        return registry;
    }
}

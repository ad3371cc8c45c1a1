package org.kconfig4j.frontend.lexer;

import org.kconfig4j.model.Symbol;

/**
 * A token of a Kconfig line.
 *
 * @param type   The kind of token.
 * @param text   The keyword or operator text, or the string for {@link TokenType#TEXT}.
 * @param symbol The referenced symbol for {@link TokenType#SYMBOL}, otherwise {@code null}.
 */
public record Token(TokenType type, String text, Symbol symbol) {

    public static Token of(TokenType type) {
        return new Token(type, type.text(), null);
    }

    public static Token symbol(Symbol symbol) {
        return new Token(TokenType.SYMBOL, symbol.getName(), symbol);
    }

    public static Token text(String text) {
        return new Token(TokenType.TEXT, text, null);
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + (type == TokenType.SYMBOL || type == TokenType.TEXT ? "(" + text + ")" : "");
    }
}

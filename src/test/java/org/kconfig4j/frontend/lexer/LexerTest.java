package org.kconfig4j.frontend.lexer;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigSyntaxException;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.frontend.preprocessor.MacroFunctionRegistry;
import org.kconfig4j.frontend.preprocessor.PreProcessor;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.host.MapEnvironment;
import org.kconfig4j.model.Symbol;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tokenizes single Kconfig lines against a mocked symbol lookup.
 */
public class LexerTest {

    private DiagnosticsEngine diagnostics;
    private PreProcessor preProcessor;
    private SymbolLookup symbols;
    private Lexer lexer;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        diagnostics.setLogDiagnostics(false);
        preProcessor = new PreProcessor(diagnostics,
                HostCapabilities.system().withEnvironment(new MapEnvironment().with("ARCH", "arm")),
                MacroFunctionRegistry.initialize(), false);
        preProcessor.setLocation(new SourceLocation("Kconfig", 1), null);
        symbols = mock(SymbolLookup.class);
        lexer = new Lexer(preProcessor, symbols, diagnostics);
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    @Test
    @Tag("unit")
    void tokenizesDependsOnExpression() {
        Symbol a = mock(Symbol.class);
        Symbol b = mock(Symbol.class);
        when(symbols.lookupSymbol("A")).thenReturn(a);
        when(symbols.lookupSymbol("B")).thenReturn(b);

        List<Token> tokens = lexer.tokenize("\tdepends on A && !(B || A) # trailing");

        assertThat(types(tokens)).containsExactly(
                TokenType.DEPENDS, TokenType.ON, TokenType.SYMBOL, TokenType.AND, TokenType.NOT,
                TokenType.OPEN_PAREN, TokenType.SYMBOL, TokenType.OR, TokenType.SYMBOL, TokenType.CLOSE_PAREN);
        assertThat(tokens.get(2).symbol()).isSameAs(a);
        assertThat(tokens.get(6).symbol()).isSameAs(b);
    }

    @Test
    @Tag("unit")
    void promptTextIsAStringAndQuotedValuesAreConstants() {
        Symbol constant = mock(Symbol.class);
        when(symbols.lookupConstant("arch/arm")).thenReturn(constant);

        List<Token> bool = lexer.tokenize("\tbool \"Enable it\"");
        assertThat(types(bool)).containsExactly(TokenType.BOOL, TokenType.TEXT);
        assertThat(bool.get(1).text()).isEqualTo("Enable it");

        List<Token> dflt = lexer.tokenize("\tdefault \"arch/$(ARCH)\"");
        assertThat(dflt.get(1).symbol()).isSameAs(constant);
        verify(symbols).lookupConstant("arch/arm");
    }

    @Test
    @Tag("unit")
    void comparisonOperators() {
        when(symbols.lookupSymbol("X")).thenReturn(mock(Symbol.class));
        when(symbols.lookupSymbol("10")).thenReturn(mock(Symbol.class));
        when(symbols.lookupConstant("y")).thenReturn(mock(Symbol.class));

        assertThat(types(lexer.tokenize("\tdefault y if X >= 10 && X != 10 && X < 10")))
                .contains(TokenType.GREATER_EQUAL, TokenType.UNEQUAL, TokenType.LESS);
        verify(symbols).lookupConstant("y");
    }

    @Test
    @Tag("unit")
    void blankCommentAndAssignmentLinesGiveNoTokens() {
        assertThat(lexer.tokenize("   ")).isEmpty();
        assertThat(lexer.tokenize("# a comment")).isEmpty();
        assertThat(lexer.tokenize("CC := gcc")).isEmpty();
        assertThat(preProcessor.getVariables()).containsKey("CC");
    }

    @Test
    @Tag("unit")
    void unquotedMenuTitleWarnsAboutStyle() {
        List<Token> tokens = lexer.tokenize("menu Drivers");

        assertThat(tokens.get(1).text()).isEqualTo("Drivers");
        assertThat(diagnostics.ofKind(DiagnosticKind.STYLE)).hasSize(1);
    }

    @Test
    @Tag("unit")
    void unterminatedStringIsASyntaxError() {
        assertThatThrownBy(() -> lexer.tokenize("\tprompt \"open"))
                .isInstanceOf(KconfigSyntaxException.class)
                .hasMessageContaining("unterminated string");
    }
}

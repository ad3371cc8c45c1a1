package org.kconfig4j.frontend.parser;

import org.kconfig4j.Kconfig;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigSyntaxException;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.frontend.lexer.Token;
import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.semantics.SymbolTable;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.expr.Expr;

/**
 * Provides statement handlers with access to the token stream of the current line, the line
 * reader and the tables being built.
 * This interface decouples handlers from the concrete {@link Parser} implementation.
 * <p>
 * After a line has been read, the statement keyword has already been consumed and
 * {@link #peek()} returns the token following it.
 */
public interface ParsingContext {

    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token, or {@code null} at the end of the line.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token, or {@code null} at the end of the line.
     */
    Token peek();

    /**
     * @return true if every token of the line has been consumed.
     */
    boolean isAtEnd();

    /**
     * @return The first token of the current line, or {@code null} for a blank line.
     */
    Token keyword();

    /**
     * Reads and tokenizes the next line, or hands back the current one again after {@link #reuseLine()}.
     * @return false at the end of the file.
     */
    boolean nextLine();

    /**
     * Makes the next {@link #nextLine()} return the current line again. Used when a property
     * list ends at a line that starts the next statement.
     */
    void reuseLine();

    /**
     * Reads a help text that follows a {@code help} line.
     * @param owner The owner's description, used in warnings.
     * @return The text, or {@code ""} if the help text is empty.
     */
    String readHelpText(String owner);

    Symbol expectSymbol();

    Symbol expectNonConstantSymbol();

    /**
     * Consumes a string token and checks that nothing follows it.
     */
    String expectTextAndEol();

    /**
     * Fails with "extra tokens at end of line" unless the line has been consumed.
     */
    void expectEol();

    /**
     * Parses an expression from the current position.
     * @param transformM Whether a plain {@code m} is rewritten to {@code m && MODULES}.
     */
    Expr parseExpression(boolean transformM);

    Expr expectExpressionAndEol();

    /**
     * Parses an optional {@code if <expr>} at the end of the line.
     * @return The condition, or {@code y} when there is none.
     */
    Expr parseCondition();

    /**
     * Parses statements up to {@code endToken}, linking new nodes after {@code prev}.
     * @param endToken The token that closes the block, or {@code null} for a whole file.
     * @return The last node of the block, or {@code prev} if the block was empty.
     */
    MenuNode parseBlock(TokenType endToken, MenuNode parent, MenuNode prev);

    /**
     * Parses the property lines following a statement into {@code node}.
     */
    void parseProperties(MenuNode node);

    /**
     * Creates a node at the current location.
     */
    MenuNode newNode(NodeKind kind, ConfigItem item, MenuNode parent);

    /**
     * Parses every file a {@code source} statement matches, in sorted order.
     * @param sourceKind Which of the {@code source} statements this is.
     * @param pattern    The file name or glob pattern.
     * @return The last node parsed, or {@code prev} if nothing was included.
     */
    MenuNode includeFiles(TokenType sourceKind, String pattern, MenuNode parent, MenuNode prev);

    Kconfig getKconfig();

    SymbolTable getSymbols();

    DiagnosticsEngine getDiagnostics();

    SourceLocation getLocation();

    /**
     * @return An exception for a syntax error on the current line, for the caller to throw.
     */
    KconfigSyntaxException error(String message);

    /**
     * Reports a warning without location.
     */
    void warn(String message);

    /**
     * Reports a warning at the current location.
     */
    void warnHere(String message);
}

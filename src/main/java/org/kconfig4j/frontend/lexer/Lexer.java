package org.kconfig4j.frontend.lexer;

import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.frontend.preprocessor.PreProcessor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits one (joined) Kconfig line into tokens, expanding macros as it goes.
 * <p>
 * The first word decides what the line is: a keyword starts a statement or property; anything
 * else is handed to the preprocessor as a variable assignment. Words after a keyword that takes a
 * string (e.g. {@code bool}, {@code menu}) are strings even without quotes; elsewhere words are
 * symbol references, with {@code n}, {@code m} and {@code y} resolving to constants.
 */
public class Lexer {

    private static final Pattern COMMAND = Pattern.compile("\\s*([A-Za-z0-9_-]+)\\s*");
    private static final Pattern ID_KEYWORD = Pattern.compile("([A-Za-z0-9_$/.-]+)\\s*");

    private final PreProcessor preProcessor;
    private final SymbolLookup symbols;
    private final DiagnosticsEngine diagnostics;

    public Lexer(PreProcessor preProcessor, SymbolLookup symbols, DiagnosticsEngine diagnostics) {
        this.preProcessor = preProcessor;
        this.symbols = symbols;
        this.diagnostics = diagnostics;
    }

    /**
     * Tokenizes a line.
     *
     * @param line The line, with continuation lines already joined and without the newline.
     * @return The tokens. Empty for blank lines, comment lines and preprocessor assignments.
     */
    public List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        String s = line;

        Matcher command = COMMAND.matcher(s);
        if (!command.lookingAt()) {
            String trimmed = s.stripLeading();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                return tokens;
            }
            if (trimmed.startsWith("$(")) {
                preProcessor.processAssignment(s);
                return tokens;
            }
            throw preProcessor.syntaxError("unknown token at start of line");
        }

        Optional<TokenType> first = TokenType.keyword(command.group(1));
        if (first.isEmpty()) {
            // old tools accepted things like "-help-"
            if (stripChars(s, " \t-").equals("help")) {
                tokens.add(Token.of(TokenType.HELP));
                return tokens;
            }
            preProcessor.processAssignment(s);
            return tokens;
        }
        Token previous = Token.of(first.get());
        tokens.add(previous);
        int i = command.end();

        while (i < s.length()) {
            Token token;
            Matcher word = ID_KEYWORD.matcher(s);
            word.region(i, s.length());

            if (word.lookingAt()) {
                String name = word.group(1);
                Optional<TokenType> keyword = TokenType.keyword(name);
                if (keyword.isPresent()) {
                    token = Token.of(keyword.get());
                    i = word.end();
                } else if (!previous.type().isStringLex()) {
                    if (name.indexOf('$') >= 0) {
                        PreProcessor.Expansion expansion = preProcessor.expandName(s, i);
                        s = expansion.text();
                        name = s.substring(i, expansion.end());
                        i = skipWhitespace(s, expansion.end());
                    } else {
                        i = word.end();
                    }
                    token = Token.symbol(isTristateName(name)
                            ? symbols.lookupConstant(name)
                            : symbols.lookupSymbol(name));
                } else {
                    // unquoted string, e.g. 'menu title' or a choice name
                    if (previous.type() != TokenType.CHOICE) {
                        diagnostics.reportWarning(DiagnosticKind.STYLE, "style: quotes recommended around '" + name
                                + "' in '" + line.strip() + "'", preProcessor.getLocation());
                    }
                    token = Token.text(name);
                    i = word.end();
                }
            } else {
                char c = s.charAt(i);
                if (c == '"' || c == '\'') {
                    String value;
                    if (s.indexOf('$') < 0 && s.indexOf('\\') < 0) {
                        int end = s.indexOf(c, i + 1);
                        if (end < 0) {
                            throw preProcessor.syntaxError("unterminated string");
                        }
                        value = s.substring(i + 1, end);
                        i = end + 1;
                    } else {
                        PreProcessor.Expansion expansion = preProcessor.expandString(s, i);
                        s = expansion.text();
                        value = preProcessor.expandLegacyReferences(s.substring(i + 1, expansion.end() - 1));
                        i = expansion.end();
                    }
                    // 'option env="FOO"' names an environment variable, not a constant
                    token = previous.type().isStringLex() || tokens.get(0).is(TokenType.OPTION)
                            ? Token.text(value)
                            : Token.symbol(symbols.lookupConstant(value));
                } else if (c == '&') {
                    token = Token.of(TokenType.AND);
                    i += 2;
                } else if (c == '|') {
                    token = Token.of(TokenType.OR);
                    i += 2;
                } else if (c == '!') {
                    if (s.startsWith("=", i + 1)) {
                        token = Token.of(TokenType.UNEQUAL);
                        i += 2;
                    } else {
                        token = Token.of(TokenType.NOT);
                        i += 1;
                    }
                } else if (c == '=') {
                    token = Token.of(TokenType.EQUAL);
                    i += 1;
                } else if (c == '(') {
                    token = Token.of(TokenType.OPEN_PAREN);
                    i += 1;
                } else if (c == ')') {
                    token = Token.of(TokenType.CLOSE_PAREN);
                    i += 1;
                } else if (c == '#') {
                    break;
                } else if (c == '<') {
                    if (s.startsWith("=", i + 1)) {
                        token = Token.of(TokenType.LESS_EQUAL);
                        i += 2;
                    } else {
                        token = Token.of(TokenType.LESS);
                        i += 1;
                    }
                } else if (c == '>') {
                    if (s.startsWith("=", i + 1)) {
                        token = Token.of(TokenType.GREATER_EQUAL);
                        i += 2;
                    } else {
                        token = Token.of(TokenType.GREATER);
                        i += 1;
                    }
                } else {
                    throw preProcessor.syntaxError("unknown tokens in line");
                }
                i = skipWhitespace(s, i);
            }

            tokens.add(token);
            previous = token;
        }
        return tokens;
    }

    private static boolean isTristateName(String name) {
        return name.equals("n") || name.equals("m") || name.equals("y");
    }

    private static int skipWhitespace(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static String stripChars(String s, String chars) {
        int start = 0;
        int end = s.length();
        while (start < end && chars.indexOf(s.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(start, end);
    }
}

package org.kconfig4j.frontend.parser;

import org.kconfig4j.Kconfig;
import org.kconfig4j.diagnostics.DiagnosticKind;
import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigInclusionException;
import org.kconfig4j.diagnostics.KconfigSyntaxException;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.frontend.io.SourceLoader;
import org.kconfig4j.frontend.lexer.Lexer;
import org.kconfig4j.frontend.lexer.Token;
import org.kconfig4j.frontend.lexer.TokenType;
import org.kconfig4j.frontend.preprocessor.PreProcessor;
import org.kconfig4j.frontend.semantics.SymbolTable;
import org.kconfig4j.host.FileSystemAccess;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.expr.Expr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The statement parser. Reads Kconfig files line by line, joins continuation lines, tokenizes
 * them through the {@link Lexer} and dispatches statements to the handlers of a
 * {@link StatementRegistry}. {@code source} statements are followed recursively; the files of the
 * enclosing {@code source} statements are kept on a stack.
 * <p>
 * The result is an unfinalized menu tree linked below the engine's top node.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    /**
     * Read position in one file, saved while a sourced file is parsed.
     */
    private record FileState(List<String> lines, int lineIndex, String fileName, int lineNumber,
                             List<SourceLocation> includePath) {}

    private final Kconfig kconfig;
    private final SymbolTable symbols;
    private final PreProcessor preProcessor;
    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final FileSystemAccess fileSystem;
    private final Path srctree;
    private final StatementRegistry statements;
    private final PropertyParser properties;
    private final ExpressionParser expressions;

    private final Deque<FileState> fileStack = new ArrayDeque<>();
    private final List<String> kconfigFilenames = new ArrayList<>();

    private List<String> lines = List.of();
    private int lineIndex;
    private String fileName;
    private int lineNumber;
    private List<SourceLocation> includePath = List.of();

    private String currentLine = "";
    private List<Token> tokens = List.of();
    private int tokenIndex;
    private boolean reuseTokens;

    /**
     * @param kconfig      The engine the tree is built for.
     * @param symbols      The tables to populate.
     * @param preProcessor The macro preprocessor, shared by all files.
     * @param srctree      The source tree file names are resolved against, or {@code null}.
     */
    public Parser(Kconfig kconfig, SymbolTable symbols, PreProcessor preProcessor, Path srctree) {
        this.kconfig = kconfig;
        this.symbols = symbols;
        this.preProcessor = preProcessor;
        this.diagnostics = kconfig.getDiagnostics();
        this.lexer = new Lexer(preProcessor, symbols, diagnostics);
        this.fileSystem = kconfig.getHost().fileSystem();
        this.srctree = srctree;
        this.statements = StatementRegistry.initialize();
        this.properties = new PropertyParser(this);
        this.expressions = new ExpressionParser(this);
    }

    /**
     * Parses the top-level Kconfig file and everything it sources.
     *
     * @param file    The file, resolved against the source tree when relative.
     * @param topNode The node the parsed statements are linked after.
     * @throws IOException If the top-level file cannot be read.
     */
    public void parse(Path file, MenuNode topNode) throws IOException {
        Path resolved = srctree != null ? srctree.resolve(file) : file;
        SourceLoader.LoadResult loaded = SourceLoader.loadFile(fileSystem, resolved, null);
        lines = loaded.lines();
        lineIndex = 0;
        fileName = file.toString().replace('\\', '/');
        lineNumber = 0;
        kconfigFilenames.add(fileName);
        log.debug("Parsing {}", fileName);

        MenuNode last = parseBlock(null, topNode, topNode);
        last.setNext(null);
    }

    /**
     * Parses a free-standing expression, e.g. for {@code Kconfig.evalString}.
     */
    public Expr parseStandaloneExpression(String text) {
        currentLine = text;
        preProcessor.setLocation(null, text);
        tokens = lexer.tokenize("if " + text);
        tokenIndex = 1;
        reuseTokens = false;
        return expectExpressionAndEol();
    }

    /**
     * @return Every parsed file, in parse order, as shown in locations.
     */
    public List<String> getKconfigFilenames() {
        return Collections.unmodifiableList(kconfigFilenames);
    }

    // ---- line reading ----

    @Override
    public boolean nextLine() {
        if (reuseTokens) {
            reuseTokens = false;
            tokenIndex = 1;
            return true;
        }
        String line = readPhysicalLine();
        if (line == null) {
            return false;
        }
        tokenizeLine(joinContinuations(line));
        return true;
    }

    @Override
    public void reuseLine() {
        reuseTokens = true;
    }

    private String readPhysicalLine() {
        if (lineIndex >= lines.size()) {
            return null;
        }
        lineNumber++;
        return lines.get(lineIndex++);
    }

    private String joinContinuations(String line) {
        while (line.endsWith("\\")) {
            String next = readPhysicalLine();
            line = line.substring(0, line.length() - 1) + (next != null ? next : "");
            if (next == null) {
                break;
            }
        }
        return line;
    }

    private void tokenizeLine(String line) {
        currentLine = line;
        preProcessor.setLocation(getLocation(), line);
        tokens = lexer.tokenize(line);
        tokenIndex = 1;
    }

    @Override
    public String readHelpText(String owner) {
        HelpTextReader.HelpText help = HelpTextReader.read(this::readPhysicalLine);
        if (help.text().isEmpty()) {
            warn(owner + " has 'help' but empty help text");
        }
        if (help.lineAfter() != null) {
            // the line that ended the help text belongs to the enclosing block
            tokenizeLine(joinContinuations(help.lineAfter()));
            reuseTokens = true;
        }
        return help.text();
    }

    // ---- tokens ----

    @Override
    public Token keyword() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    @Override
    public Token peek() {
        return tokenIndex < tokens.size() ? tokens.get(tokenIndex) : null;
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (token != null) {
            tokenIndex++;
        }
        return token;
    }

    @Override
    public boolean check(TokenType type) {
        Token token = peek();
        return token != null && token.is(type);
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                tokenIndex++;
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isAtEnd() {
        return tokenIndex >= tokens.size();
    }

    @Override
    public Symbol expectSymbol() {
        Token token = advance();
        if (token == null || !token.is(TokenType.SYMBOL)) {
            throw error("expected symbol");
        }
        return token.symbol();
    }

    @Override
    public Symbol expectNonConstantSymbol() {
        Token token = advance();
        if (token == null || !token.is(TokenType.SYMBOL) || token.symbol().isConstant()) {
            throw error("expected nonconstant symbol");
        }
        return token.symbol();
    }

    @Override
    public String expectTextAndEol() {
        Token token = advance();
        if (token == null || !token.is(TokenType.TEXT)) {
            throw error("expected string");
        }
        expectEol();
        return token.text();
    }

    @Override
    public void expectEol() {
        if (!isAtEnd()) {
            throw error("extra tokens at end of line");
        }
    }

    @Override
    public Expr parseExpression(boolean transformM) {
        return expressions.parse(transformM);
    }

    @Override
    public Expr expectExpressionAndEol() {
        Expr expr = parseExpression(true);
        expectEol();
        return expr;
    }

    @Override
    public Expr parseCondition() {
        Expr condition = match(TokenType.IF) ? parseExpression(true) : kconfig.y();
        expectEol();
        return condition;
    }

    // ---- blocks ----

    @Override
    public MenuNode parseBlock(TokenType endToken, MenuNode parent, MenuNode prev) {
        while (nextLine()) {
            Token first = keyword();
            if (first == null) {
                continue;
            }
            TokenType type = first.type();

            if (endToken != null && type == endToken) {
                expectEol();
                prev.setNext(null);
                return prev;
            }

            Optional<IStatementHandler> handler = statements.get(type);
            if (handler.isEmpty()) {
                throw error(type == TokenType.ENDCHOICE ? "no corresponding 'choice'"
                        : type == TokenType.ENDIF ? "no corresponding 'if'"
                        : type == TokenType.ENDMENU ? "no corresponding 'menu'"
                        : "unrecognized construct");
            }
            prev = handler.get().parse(this, type, parent, prev);
        }

        if (endToken != null) {
            throw new KconfigSyntaxException("error: expected '" + endToken.text() + "' at end of '" + fileName + "'");
        }
        return prev;
    }

    @Override
    public void parseProperties(MenuNode node) {
        properties.parse(node);
    }

    @Override
    public MenuNode newNode(NodeKind kind, ConfigItem item, MenuNode parent) {
        MenuNode node = new MenuNode(kconfig, kind, item, getLocation());
        node.setParent(parent);
        node.setIncludePath(includePath);
        return node;
    }

    // ---- file inclusion ----

    @Override
    public MenuNode includeFiles(TokenType sourceKind, String pattern, MenuNode parent, MenuNode prev) {
        if (sourceKind.isRelativeSource()) {
            pattern = relativeToCurrentFile(pattern);
        }

        Path base = srctree != null ? srctree : Path.of("");
        List<Path> matches;
        try {
            matches = fileSystem.glob(base, pattern);
        } catch (IOException e) {
            throw new KconfigInclusionException(getLocation() + ": could not expand '" + pattern + "': "
                    + e.getMessage(), e);
        }

        if (matches.isEmpty() && sourceKind.isObligatorySource()) {
            throw new KconfigInclusionException(getLocation() + ": '" + pattern + "' not found (in '"
                    + currentLineText() + "'). Check that environment variables are set correctly (e.g. $srctree, "
                    + "which is " + (srctree != null ? "set to '" + srctree + "'" : "unset or blank")
                    + "). Also note that unset environment variables expand to the empty string.");
        }

        for (Path match : matches) {
            enterFile(match);
            prev = parseBlock(null, parent, prev);
            leaveFile();
        }
        return prev;
    }

    private String relativeToCurrentFile(String pattern) {
        if (pattern.startsWith("/")) {
            return pattern;
        }
        int slash = fileName.lastIndexOf('/');
        return slash < 0 ? pattern : fileName.substring(0, slash) + "/" + pattern;
    }

    private void enterFile(Path path) {
        String logicalName = SourceLoader.logicalName(path, srctree);
        kconfigFilenames.add(logicalName);

        List<SourceLocation> nested = new ArrayList<>(includePath);
        nested.add(getLocation());
        for (SourceLocation location : nested) {
            if (location.fileName().equals(logicalName)) {
                throw new KconfigInclusionException(getLocation() + ": recursive 'source' of '" + logicalName
                        + "' detected. Check that environment variables are set correctly.\nInclude path:\n"
                        + nested.stream().map(SourceLocation::toString).collect(Collectors.joining("\n")));
            }
        }

        SourceLoader.LoadResult loaded;
        try {
            loaded = SourceLoader.loadFile(fileSystem, path, srctree);
        } catch (IOException e) {
            throw new KconfigInclusionException(getLocation() + ": Could not open '" + path + "' (in '"
                    + currentLineText() + "') (" + e.getMessage() + ")", e);
        }
        log.debug("Sourcing {} from {}", logicalName, getLocation());

        fileStack.push(new FileState(lines, lineIndex, fileName, lineNumber, includePath));
        lines = loaded.lines();
        lineIndex = 0;
        fileName = logicalName;
        lineNumber = 0;
        includePath = List.copyOf(nested);
    }

    private void leaveFile() {
        FileState state = fileStack.pop();
        lines = state.lines();
        lineIndex = state.lineIndex();
        fileName = state.fileName();
        lineNumber = state.lineNumber();
        includePath = state.includePath();
    }

    private String currentLineText() {
        return currentLine.strip();
    }

    // ---- context ----

    @Override
    public Kconfig getKconfig() {
        return kconfig;
    }

    @Override
    public SymbolTable getSymbols() {
        return symbols;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public SourceLocation getLocation() {
        return new SourceLocation(fileName, lineNumber);
    }

    @Override
    public KconfigSyntaxException error(String message) {
        return preProcessor.syntaxError(message);
    }

    @Override
    public void warn(String message) {
        diagnostics.reportWarning(DiagnosticKind.GENERAL, message);
    }

    @Override
    public void warnHere(String message) {
        diagnostics.reportWarning(DiagnosticKind.GENERAL, message, getLocation());
    }
}

package org.kconfig4j;

import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.frontend.parser.Parser;
import org.kconfig4j.frontend.preprocessor.MacroFunctionRegistry;
import org.kconfig4j.frontend.preprocessor.PreProcessor;
import org.kconfig4j.frontend.preprocessor.Variable;
import org.kconfig4j.frontend.semantics.DependencyGraphBuilder;
import org.kconfig4j.frontend.semantics.DependencyLoopChecker;
import org.kconfig4j.frontend.semantics.SanityChecker;
import org.kconfig4j.frontend.semantics.SymbolTable;
import org.kconfig4j.frontend.semantics.TreeFinalizer;
import org.kconfig4j.frontend.semantics.UndefinedSymbolChecker;
import org.kconfig4j.host.HostCapabilities;
import org.kconfig4j.model.Choice;
import org.kconfig4j.model.ConfigItem;
import org.kconfig4j.model.MenuNode;
import org.kconfig4j.model.NodeKind;
import org.kconfig4j.model.PromptProperty;
import org.kconfig4j.model.ResolutionContext;
import org.kconfig4j.model.Symbol;
import org.kconfig4j.model.SymbolType;
import org.kconfig4j.model.Tristate;
import org.kconfig4j.model.expr.Expr;
import org.kconfig4j.serializer.AutoconfWriter;
import org.kconfig4j.serializer.ConfigFileReader;
import org.kconfig4j.serializer.ConfigWriter;
import org.kconfig4j.serializer.LoadResult;
import org.kconfig4j.serializer.WriteResult;
import org.kconfig4j.tracker.DependencyTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed Kconfig tree together with the current configuration.
 * <p>
 * Construction parses the top-level Kconfig file and everything it sources, finalizes the menu
 * tree, runs the sanity checks and builds the dependency graph used for cache invalidation.
 * Symbol values are then computed on demand. Configuration files are read and written through
 * {@link #loadConfig}, {@link #writeConfig}, {@link #writeMinConfig} and {@link #writeAutoconf}.
 * <p>
 * An instance is not thread-safe, but separate instances share no state and can be used from
 * different threads.
 */
public class Kconfig implements ResolutionContext {

    private static final Logger log = LoggerFactory.getLogger(Kconfig.class);

    private final KconfigOptions options;
    private final HostCapabilities host;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final SymbolTable symbols;
    private final PreProcessor preProcessor;
    private final Parser parser;
    private final String filename;

    private Symbol constN;
    private Symbol constM;
    private Symbol constY;
    private Symbol modules;
    private Symbol defconfigList;
    private final MenuNode topNode;

    private List<Symbol> uniqueDefinedSymbols = List.of();
    private List<Choice> uniqueChoices = List.of();
    private final List<LoadResult.MissingSymbol> missingSymbols = new ArrayList<>();

    private boolean warnAssignNoPrompt;
    private boolean warnAssignUndefined;
    private boolean warnAssignOverride;
    private boolean warnAssignRedundant;

    /**
     * Parses {@code filename} with the default options, the process environment and the built-in
     * preprocessor functions.
     *
     * @throws IOException If the top-level file cannot be read.
     */
    public Kconfig(Path filename) throws IOException {
        this(filename, KconfigOptions.defaults(), HostCapabilities.system(), MacroFunctionRegistry.initialize());
    }

    /**
     * Parses {@code filename}.
     *
     * @param filename  The top-level Kconfig file, looked up in the source tree when relative.
     * @param options   Engine settings; environment overrides from {@code host} are applied on top.
     * @param host      Environment, command and file system capabilities.
     * @param functions The preprocessor functions.
     * @throws IOException If the top-level file cannot be read.
     * @throws org.kconfig4j.diagnostics.KconfigException On syntax errors, missing or recursive
     *     {@code source}s, fatal undefined references and dependency loops.
     */
    public Kconfig(Path filename, KconfigOptions options, HostCapabilities host, MacroFunctionRegistry functions)
            throws IOException {
        this.options = options.withEnvironment(host.environment());
        this.host = host;
        this.filename = filename.toString().replace('\\', '/');
        this.diagnostics.setWarningsEnabled(this.options.warningsEnabled());
        this.diagnostics.setLogDiagnostics(this.options.warningsToLog());
        this.warnAssignUndefined = this.options.warnAssignUndefined();
        this.warnAssignOverride = this.options.warnAssignOverride();
        this.warnAssignRedundant = this.options.warnAssignRedundant();

        this.symbols = new SymbolTable(this);
        createTristateConstants();
        this.modules = symbols.lookupSymbol("MODULES");

        this.topNode = new MenuNode(this, NodeKind.MENU, null, new SourceLocation(this.filename, 1));
        topNode.setPrompt(new PromptProperty("Main menu", y()));
        topNode.setMenuconfig(true);

        this.preProcessor = new PreProcessor(diagnostics, host, functions, this.options.strictPreprocessor());
        this.parser = new Parser(this, symbols, preProcessor, this.options.srctree());
        parser.parse(filename, topNode);
        topNode.setList(topNode.getNext());
        topNode.setNext(null);

        finishParsing();
        warnAssignNoPrompt = true;
        log.debug("Parsed {}: {} symbols, {} choices, {} files", this.filename, uniqueDefinedSymbols.size(),
                uniqueChoices.size(), parser.getKconfigFilenames().size());
    }

    private void createTristateConstants() {
        constN = new Symbol(this, "n", true);
        constM = new Symbol(this, "m", true);
        constY = new Symbol(this, "y", true);
        // n did not exist yet when the constants were created
        for (Symbol constant : List.of(constN, constM, constY)) {
            constant.setOrigType(SymbolType.TRISTATE);
            constant.setRevDep(constN.expr());
            constant.setWeakRevDep(constN.expr());
            constant.setDirectDep(constN.expr());
            symbols.addConstant(constant);
        }
    }

    private void finishParsing() {
        TreeFinalizer finalizer = new TreeFinalizer();
        finalizer.finalizeNode(topNode, y());
        finalizer.inferTypes(symbols.getDefinedSymbols());

        uniqueDefinedSymbols = symbols.getUniqueDefinedSymbols();
        uniqueChoices = symbols.getUniqueChoices();

        SanityChecker sanity = new SanityChecker(this);
        sanity.checkSymbols(uniqueDefinedSymbols);
        sanity.checkChoices(uniqueChoices);

        if (options.warnUndefined() || options.undefinedAsError()) {
            new UndefinedSymbolChecker(diagnostics, options.undefinedAsError())
                    .check(symbols.getSymbols().values(), nodes(false));
        }

        DependencyGraphBuilder.build(uniqueDefinedSymbols, uniqueChoices);
        new DependencyLoopChecker(this).check(uniqueDefinedSymbols);
        DependencyGraphBuilder.addChoiceDependencies(uniqueChoices);
    }

    // ---- resolution context ----

    @Override
    public Symbol getModules() {
        return modules;
    }

    /**
     * Makes {@code sym} the symbol that enables {@code m} values ({@code option modules}).
     */
    public void setModules(Symbol sym) {
        this.modules = sym;
    }

    @Override
    public Symbol getDefconfigList() {
        return defconfigList;
    }

    public void setDefconfigList(Symbol sym) {
        this.defconfigList = sym;
    }

    @Override
    public Expr n() {
        return constN != null ? constN.expr() : null;
    }

    public Expr m() {
        return constM.expr();
    }

    @Override
    public Expr y() {
        return constY.expr();
    }

    @Override
    public String getConfigPrefix() {
        return options.configPrefix();
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isWarnAssignNoPrompt() {
        return warnAssignNoPrompt;
    }

    /**
     * Switches the "has no prompt" assignment warning. The readers turn it off while applying files.
     */
    public void setWarnAssignNoPrompt(boolean warn) {
        this.warnAssignNoPrompt = warn;
    }

    @Override
    public void invalidateAll() {
        for (Symbol sym : symbols.getSymbols().values()) {
            sym.invalidateCachedValues();
        }
        for (Choice choice : uniqueChoices) {
            choice.invalidateCachedValues();
        }
    }

    // ---- tree and tables ----

    public KconfigOptions getOptions() {
        return options;
    }

    public HostCapabilities getHost() {
        return host;
    }

    /**
     * @return The top-level Kconfig file name as given.
     */
    public String getFilename() {
        return filename;
    }

    public MenuNode getTopNode() {
        return topNode;
    }

    /**
     * @return The {@code mainmenu} title, {@code "Main menu"} without one.
     */
    public String getMainmenuText() {
        return topNode.getPrompt().text();
    }

    /**
     * @return The source tree directory, or {@code null} if none is set.
     */
    public Path getSrctree() {
        return options.srctree();
    }

    /**
     * @return All non-constant symbols by name, undefined ones included.
     */
    public Map<String, Symbol> getSymbols() {
        return symbols.getSymbols();
    }

    public Optional<Symbol> getSymbol(String name) {
        return symbols.get(name);
    }

    /**
     * @return Constant symbols by name: quoted strings, numbers and {@code n}/{@code m}/{@code y}.
     */
    public Map<String, Symbol> getConstants() {
        return symbols.getConstants();
    }

    /**
     * @return Defined symbols in definition order, once per definition.
     */
    public List<Symbol> getDefinedSymbols() {
        return symbols.getDefinedSymbols();
    }

    /**
     * @return Defined symbols in order of their first definition, each once.
     */
    public List<Symbol> getUniqueDefinedSymbols() {
        return uniqueDefinedSymbols;
    }

    public Map<String, Choice> getNamedChoices() {
        return symbols.getNamedChoices();
    }

    public List<Choice> getUniqueChoices() {
        return uniqueChoices;
    }

    public List<MenuNode> getMenus() {
        return symbols.getMenus();
    }

    public List<MenuNode> getComments() {
        return symbols.getComments();
    }

    /**
     * @return Preprocessor variables as they were at the end of parsing.
     */
    public Map<String, Variable> getVariables() {
        return preProcessor.getVariables();
    }

    /**
     * @return Every environment variable the Kconfig files referenced, in first-reference order.
     */
    public Set<String> envVars() {
        return preProcessor.getEnvVars();
    }

    /**
     * Records an environment variable read by {@code option env}.
     */
    public void recordEnvVar(String name) {
        preProcessor.recordEnvVar(name);
    }

    /**
     * Substitutes {@code $NAME} and {@code ${NAME}} environment references, leaving unset ones as they are.
     */
    public String expandEnvReferences(String s) {
        return preProcessor.expandLegacyReferences(s);
    }

    /**
     * @return Every parsed Kconfig file in parse order.
     */
    public List<String> kconfigFilenames() {
        return parser.getKconfigFilenames();
    }

    /**
     * @return The formatted warnings reported so far.
     */
    public List<String> warnings() {
        return diagnostics.warnings();
    }

    /**
     * Walks the finalized menu tree depth-first, parents before children. The top node is not included.
     *
     * @param uniqueSymbols Whether to return only the first node of symbols defined in several places.
     */
    public List<MenuNode> nodes(boolean uniqueSymbols) {
        List<MenuNode> out = new ArrayList<>();
        Set<ConfigItem> seen = new HashSet<>();
        MenuNode node = topNode;
        while (true) {
            if (node.getList() != null) {
                node = node.getList();
            } else if (node.getNext() != null) {
                node = node.getNext();
            } else {
                MenuNode next = null;
                while (node.getParent() != null) {
                    node = node.getParent();
                    if (node.getNext() != null) {
                        next = node.getNext();
                        break;
                    }
                }
                if (next == null) {
                    return out;
                }
                node = next;
            }
            if (uniqueSymbols && node.getSymbol() != null && !seen.add(node.getSymbol())) {
                continue;
            }
            out.add(node);
        }
    }

    /**
     * Evaluates an expression in Kconfig syntax against the current configuration, e.g.
     * {@code "FOO && (BAR || !BAZ)"}.
     *
     * @throws org.kconfig4j.diagnostics.KconfigSyntaxException If the expression does not parse.
     */
    public Tristate evalString(String expression) {
        return parser.parseStandaloneExpression(expression).value();
    }

    // ---- user values ----

    /**
     * Removes every user value of symbols and choices.
     */
    public void unsetValues() {
        boolean previous = warnAssignNoPrompt;
        warnAssignNoPrompt = false;
        try {
            for (Symbol sym : uniqueDefinedSymbols) {
                sym.unsetValue();
            }
            for (Choice choice : uniqueChoices) {
                choice.unsetValue();
            }
        } finally {
            warnAssignNoPrompt = previous;
        }
    }

    /**
     * @return Assignments to undefined symbols seen by the last {@link #loadConfig} that replaced
     *     the configuration, plus those of later merges. Modifiable, for the readers.
     */
    public List<LoadResult.MissingSymbol> missingSymbols() {
        return missingSymbols;
    }

    public boolean isWarnAssignUndefined() {
        return warnAssignUndefined;
    }

    public void setWarnAssignUndefined(boolean warn) {
        this.warnAssignUndefined = warn;
    }

    public boolean isWarnAssignOverride() {
        return warnAssignOverride;
    }

    public void setWarnAssignOverride(boolean warn) {
        this.warnAssignOverride = warn;
    }

    public boolean isWarnAssignRedundant() {
        return warnAssignRedundant;
    }

    public void setWarnAssignRedundant(boolean warn) {
        this.warnAssignRedundant = warn;
    }

    // ---- configuration files ----

    /**
     * @return The configuration file name: {@code KCONFIG_CONFIG}, else the configured default ({@code .config}).
     */
    public String standardConfigFilename() {
        return options.configFile();
    }

    /**
     * Loads the configuration file named by {@link #standardConfigFilename()}, falling back to
     * {@link #defconfigFilename()} when it does not exist.
     */
    public LoadResult loadConfig() throws IOException {
        return new ConfigFileReader(this).load(null, true);
    }

    /**
     * Loads a configuration file.
     *
     * @param path    The file; relative paths that do not exist are also tried under the source tree.
     * @param replace Whether symbols the file does not mention lose their user values.
     * @throws IOException If the file cannot be read.
     */
    public LoadResult loadConfig(Path path, boolean replace) throws IOException {
        return new ConfigFileReader(this).load(path, replace);
    }

    /**
     * Merges the file named by {@code KCONFIG_ALLCONFIG}, if that variable is set. An empty value
     * or {@code 1} means {@code defaultName}, then {@code all.config}.
     *
     * @return The load result, or empty if {@code KCONFIG_ALLCONFIG} is not set.
     * @throws IOException If none of the candidate files can be read.
     */
    public Optional<LoadResult> loadAllConfig(String defaultName) throws IOException {
        return new ConfigFileReader(this).loadAll(defaultName);
    }

    /**
     * @return The first existing file among the defaults of the {@code option defconfig_list}
     *     symbol whose condition holds, or {@code null}.
     */
    public Path defconfigFilename() {
        return new ConfigFileReader(this).defconfigFilename();
    }

    public WriteResult writeConfig() throws IOException {
        return writeConfig(Path.of(standardConfigFilename()), null);
    }

    /**
     * Writes the configuration in {@code .config} format, keeping the previous file as
     * {@code <path>.old}. Nothing is written if the content would not change.
     *
     * @param header Text for the top of the file, or {@code null} for the configured header.
     */
    public WriteResult writeConfig(Path path, String header) throws IOException {
        return new ConfigWriter(this).writeConfig(path, header);
    }

    /**
     * Writes only the values that differ from what the defaults would give.
     */
    public WriteResult writeMinConfig(Path path, String header) throws IOException {
        return new ConfigWriter(this).writeMinConfig(path, header);
    }

    public WriteResult writeAutoconf() throws IOException {
        return writeAutoconf(Path.of(options.autoconfFile()), null);
    }

    /**
     * Writes the configuration as a C header of {@code #define}s.
     */
    public WriteResult writeAutoconf(Path path, String header) throws IOException {
        return new AutoconfWriter(this).write(path, header);
    }

    /**
     * Updates the dependency marker files under {@code dir} for every symbol whose value changed
     * since the previous call, and records the current values in {@code dir/auto.conf}.
     */
    public void syncDeps(Path dir) throws IOException {
        new DependencyTracker(this).syncDeps(dir);
    }

    @Override
    public String toString() {
        List<String> fields = new ArrayList<>();
        fields.add("configuration with " + symbols.getSymbols().size() + " symbols");
        fields.add("main menu prompt \"" + getMainmenuText() + "\"");
        fields.add("srctree " + (options.srctree() != null ? "\"" + options.srctree() + "\"" : "is current directory"));
        fields.add("config symbol prefix \"" + options.configPrefix() + "\"");
        fields.add("warnings " + (diagnostics.isWarningsEnabled() ? "enabled" : "disabled"));
        fields.add("undef. symbol assignment warnings " + (warnAssignUndefined ? "enabled" : "disabled"));
        fields.add("overriding symbol assignment warnings " + (warnAssignOverride ? "enabled" : "disabled"));
        fields.add("redundant symbol assignment warnings " + (warnAssignRedundant ? "enabled" : "disabled"));
        return "<" + String.join(", ", fields) + ">";
    }
}

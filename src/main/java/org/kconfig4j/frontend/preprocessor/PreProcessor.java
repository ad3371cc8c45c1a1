package org.kconfig4j.frontend.preprocessor;

import org.kconfig4j.diagnostics.DiagnosticsEngine;
import org.kconfig4j.diagnostics.KconfigException;
import org.kconfig4j.diagnostics.KconfigReferenceException;
import org.kconfig4j.diagnostics.KconfigSyntaxException;
import org.kconfig4j.diagnostics.SourceLocation;
import org.kconfig4j.host.HostCapabilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The macro preprocessor. It expands {@code $(...)} references in Kconfig lines before and while
 * they are tokenized, and handles variable assignment lines ({@code x := ...}, {@code x = ...},
 * {@code x += ...}).
 * <p>
 * A reference {@code $(name,arg,...)} resolves, in order, to a variable (arguments become
 * {@code $(1)}, {@code $(2)}, ...), a registered function, an environment variable, or the empty string.
 * Arguments are split on top-level commas only: commas and parentheses inside nested parentheses or
 * inside single, double or triple quoted regions do not split.
 */
public class PreProcessor implements PreProcessorContext {

    private static final Logger log = LoggerFactory.getLogger(PreProcessor.class);

    private static final int MAX_FUNCTION_DEPTH = 100;

    private static final Pattern ASSIGNMENT_LHS_FRAGMENT = Pattern.compile("[A-Za-z0-9_-]*");
    private static final Pattern ASSIGNMENT_RHS = Pattern.compile("\\s*(=|:=|\\+=)\\s*(.*)", Pattern.DOTALL);
    private static final Pattern NAME_SPECIAL = Pattern.compile("[^A-Za-z0-9_$/.-]|\\$\\(|$");
    private static final Pattern STRING_SPECIAL = Pattern.compile("\"|'|\\\\|\\$\\(");
    private static final Pattern POSITIONAL = Pattern.compile("\\s*(\\d+)\\s*");
    private static final Pattern LEGACY_ENV_REF = Pattern.compile("\\$(\\w+|\\{([^}]*)})");

    /**
     * Text after an expansion step, and the index in it where scanning continues.
     */
    public record Expansion(String text, int end) {}

    private final DiagnosticsEngine diagnostics;
    private final HostCapabilities host;
    private final MacroFunctionRegistry functions;
    private final boolean strict;
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final Set<String> envVars = new LinkedHashSet<>();

    private SourceLocation location;
    private String currentLine;

    /**
     * @param diagnostics The engine for reporting warnings.
     * @param host        Environment and command capabilities handed to functions.
     * @param functions   The callable functions.
     * @param strict      Whether referencing an unknown name is an error instead of expanding to "".
     */
    public PreProcessor(DiagnosticsEngine diagnostics, HostCapabilities host,
                        MacroFunctionRegistry functions, boolean strict) {
        this.diagnostics = diagnostics;
        this.host = host;
        this.functions = functions;
        this.strict = strict;
    }

    @Override
    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Sets the location and text of the line being processed, used by {@code $(filename)},
     * {@code $(lineno)} and in error messages.
     */
    public void setLocation(SourceLocation location, String line) {
        this.location = location;
        this.currentLine = line;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public HostCapabilities getHost() {
        return host;
    }

    @Override
    public Map<String, Variable> getVariables() {
        return Collections.unmodifiableMap(variables);
    }

    public MacroFunctionRegistry getFunctions() {
        return functions;
    }

    /**
     * @return The environment variables referenced through {@code $(NAME)}, in first-reference order.
     */
    public Set<String> getEnvVars() {
        return Collections.unmodifiableSet(envVars);
    }

    /**
     * Records an environment variable dependency that was read outside of macro expansion.
     */
    public void recordEnvVar(String name) {
        envVars.add(name);
    }

    // ---- assignments ----

    /**
     * Handles a line that is not a Kconfig statement: a variable assignment, or a bare macro
     * call that must expand to blank.
     *
     * @param line The line, without its newline.
     */
    public void processAssignment(String line) {
        String s = line.stripLeading();
        int i = 0;
        while (true) {
            Matcher fragment = ASSIGNMENT_LHS_FRAGMENT.matcher(s);
            fragment.region(i, s.length());
            fragment.lookingAt();
            i = fragment.end();
            if (s.startsWith("$(", i)) {
                Expansion e = expandMacro(s, i, List.of());
                s = e.text();
                i = e.end();
            } else {
                break;
            }
        }

        if (s.isBlank()) {
            return;
        }

        String name = s.substring(0, i);
        Matcher rhs = ASSIGNMENT_RHS.matcher(s);
        rhs.region(i, s.length());
        if (!rhs.lookingAt()) {
            throw syntaxError("syntax error");
        }
        String op = rhs.group(1);
        String value = rhs.group(2);

        Variable variable = variables.get(name);
        if (variable == null) {
            variable = new Variable(this, name);
            variables.put(name, variable);
            if (op.equals("+=")) {
                op = "=";
            }
        }

        switch (op) {
            case "=":
                variable.setRecursive(true);
                variable.setValue(value);
                break;
            case ":=":
                variable.setRecursive(false);
                variable.setValue(expandWhole(value, List.of()));
                break;
            default:
                variable.setValue(variable.getValue() + " "
                        + (variable.isRecursive() ? value : expandWhole(value, List.of())));
                break;
        }
        log.debug("Preprocessor variable {} {} '{}'", name, op, variable.getValue());
    }

    // ---- expansion ----

    /**
     * Expands every {@code $(...)} in {@code s}.
     *
     * @param args The arguments of the enclosing function call; {@code $(1)} refers to {@code args.get(1)}.
     */
    public String expandWhole(String s, List<String> args) {
        int i = 0;
        while (true) {
            i = s.indexOf("$(", i);
            if (i == -1) {
                return s;
            }
            Expansion e = expandMacro(s, i, args);
            s = e.text();
            i = e.end();
        }
    }

    /**
     * Expands macros in the unquoted symbol name starting at {@code i}.
     *
     * @return The line with macros expanded, and the index just past the name.
     * @throws KconfigSyntaxException If the name expands to blank.
     */
    public Expansion expandName(String s, int i) {
        int scan = i;
        while (true) {
            Matcher m = NAME_SPECIAL.matcher(s);
            m.find(scan);
            if (!m.group().equals("$(")) {
                if (s.substring(i, m.start()).isBlank()) {
                    throw syntaxError("macro expanded to blank string");
                }
                return new Expansion(s, m.start());
            }
            Expansion e = expandMacro(s, m.start(), List.of());
            s = e.text();
            scan = e.end();
        }
    }

    /**
     * Expands the quoted string starting at index {@code i} (which holds the opening quote).
     * Backslash escapes are resolved and macros expanded. A backslash before {@code $(} keeps the
     * macro from expanding.
     *
     * @return The line with the string's contents rewritten, and the index just past the closing quote.
     */
    public Expansion expandString(String s, int i) {
        char quote = s.charAt(i);
        i++;
        while (true) {
            Matcher m = STRING_SPECIAL.matcher(s);
            if (!m.find(i)) {
                throw syntaxError("unterminated string");
            }
            String found = m.group();
            if (found.charAt(0) == quote) {
                return new Expansion(s, m.end());
            } else if (found.equals("\\")) {
                s = s.substring(0, m.start()) + s.substring(m.end());
                // the escaped character is kept as is
                i = m.start() + 1;
            } else if (found.equals("$(")) {
                Expansion e = expandMacro(s, m.start(), List.of());
                s = e.text();
                i = e.end();
            } else {
                i = m.end();
            }
        }
    }

    /**
     * Substitutes legacy {@code $NAME} and {@code ${NAME}} environment references in quoted strings.
     * References to unset variables are left as they are.
     */
    public String expandLegacyReferences(String s) {
        if (s.indexOf('$') < 0) {
            return s;
        }
        s = s.replace("$UNAME_RELEASE", host.environment().unameRelease());
        Matcher m = LEGACY_ENV_REF.matcher(s);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(2) != null ? m.group(2) : m.group(1);
            Optional<String> value = host.environment().get(name);
            m.appendReplacement(out, Matcher.quoteReplacement(value.orElse(m.group())));
        }
        m.appendTail(out);
        return out.toString();
    }

    /**
     * Expands the macro call starting at index {@code i} ({@code "$("}).
     *
     * @return The expanded text, with everything before and after the call kept, and the index
     *     just past the inserted expansion.
     */
    public Expansion expandMacro(String s, int i, List<String> args) {
        String res = s.substring(0, i);
        i += 2;
        int argStart = i;
        List<String> callArgs = new ArrayList<>();
        int nesting = 0;

        while (true) {
            if (i >= s.length()) {
                throw syntaxError("missing end parenthesis in macro expansion");
            }
            if (s.startsWith("$(", i)) {
                Expansion nested = expandMacro(s, i, args);
                s = nested.text();
                i = nested.end();
                continue;
            }
            char c = s.charAt(i);
            if (c == '"' || c == '\'') {
                String quote = s.startsWith(String.valueOf(c).repeat(3), i)
                        ? String.valueOf(c).repeat(3)
                        : String.valueOf(c);
                Expansion quoted = skipQuoted(s, i, quote, args);
                s = quoted.text();
                i = quoted.end();
            } else if (c == '(') {
                nesting++;
                i++;
            } else if (c == ')') {
                if (nesting > 0) {
                    nesting--;
                    i++;
                    continue;
                }
                callArgs.add(s.substring(argStart, i));
                res += positionalOrCall(callArgs, args);
                return new Expansion(res + s.substring(i + 1), res.length());
            } else if (c == ',') {
                if (nesting == 0) {
                    callArgs.add(s.substring(argStart, i));
                    argStart = i + 1;
                }
                i++;
            } else {
                i++;
            }
        }
    }

    /**
     * Skips a quoted region inside macro arguments. Macros inside it still expand. A quote with no
     * closing counterpart is an ordinary character, and nothing after it is expanded here.
     */
    private Expansion skipQuoted(String s, int start, String quote, List<String> args) {
        int open = start + quote.length();
        int close = findClosingQuote(s, open, quote);
        if (close < 0) {
            return new Expansion(s, start + 1);
        }
        String inner = s.substring(open, close);
        int i = 0;
        while (i < inner.length()) {
            if (inner.charAt(i) == '\\' && i + 1 < inner.length()) {
                i += 2;
            } else if (inner.startsWith("$(", i)) {
                Expansion nested = expandMacro(inner, i, args);
                inner = nested.text();
                i = nested.end();
            } else {
                i++;
            }
        }
        String text = s.substring(0, open) + inner + s.substring(close);
        return new Expansion(text, open + inner.length() + quote.length());
    }

    /**
     * @return The index of the quote closing a region that starts at {@code i}, or -1. Nested
     *     {@code $(...)} calls are skipped whole.
     */
    private static int findClosingQuote(String s, int i, String quote) {
        int macroDepth = 0;
        while (i < s.length()) {
            if (s.charAt(i) == '\\' && i + 1 < s.length()) {
                i += 2;
                continue;
            }
            if (s.startsWith("$(", i)) {
                macroDepth++;
                i += 2;
                continue;
            }
            char c = s.charAt(i);
            if (macroDepth > 0) {
                if (c == '(') {
                    macroDepth++;
                } else if (c == ')') {
                    macroDepth--;
                }
            } else if (s.startsWith(quote, i)) {
                return i;
            }
            i++;
        }
        return -1;
    }

    private String positionalOrCall(List<String> callArgs, List<String> args) {
        Matcher positional = POSITIONAL.matcher(callArgs.get(0));
        if (positional.matches()) {
            int index = Integer.parseInt(positional.group(1));
            if (index < args.size()) {
                return args.get(index);
            }
        }
        return functionValue(callArgs);
    }

    /**
     * Calls {@code call.get(0)} with the remaining elements as arguments. A plain variable is a
     * function with no arguments.
     */
    String functionValue(List<String> call) {
        String name = call.get(0);

        Variable variable = variables.get(name);
        if (variable != null) {
            if (call.size() == 1) {
                if (variable.getExpansionDepth() > 0) {
                    throw syntaxError("Preprocessor variable " + name + " recursively references itself");
                }
            } else if (variable.getExpansionDepth() > MAX_FUNCTION_DEPTH) {
                throw syntaxError("Preprocessor function " + name + " seems stuck in infinite recursion");
            }
            variable.enter();
            try {
                return expandWhole(variable.getValue(), call);
            } finally {
                variable.leave();
            }
        }

        Optional<MacroFunctionRegistry.Entry> function = functions.get(name);
        if (function.isPresent()) {
            MacroFunctionRegistry.Entry entry = function.get();
            int argCount = call.size() - 1;
            if (!entry.accepts(argCount)) {
                throw new KconfigException(locationPrefix() + "bad number of arguments in call to " + name
                        + ", expected " + entry.expectedArgs() + ", got " + argCount);
            }
            return entry.function().invoke(this, List.copyOf(call.subList(1, call.size())));
        }

        Optional<String> env = host.environment().get(name);
        if (env.isPresent()) {
            envVars.add(name);
            return env.get();
        }

        if (strict) {
            throw new KconfigReferenceException(locationPrefix() + "'" + name + "' referenced before assignment");
        }
        return "";
    }

    private String locationPrefix() {
        return location != null ? location + ": " : "";
    }

    /**
     * @return An error pointing at the current line.
     */
    public KconfigSyntaxException syntaxError(String message) {
        if (currentLine != null) {
            return new KconfigSyntaxException(location, "couldn't parse '" + currentLine.strip() + "': " + message);
        }
        return new KconfigSyntaxException(location, message);
    }
}

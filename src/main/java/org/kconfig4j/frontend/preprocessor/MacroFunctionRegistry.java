package org.kconfig4j.frontend.preprocessor;

import org.kconfig4j.frontend.preprocessor.features.location.FilenameFunction;
import org.kconfig4j.frontend.preprocessor.features.location.LinenoFunction;
import org.kconfig4j.frontend.preprocessor.features.probe.CcOptionBitFunction;
import org.kconfig4j.frontend.preprocessor.features.probe.ToolchainProbe;
import org.kconfig4j.frontend.preprocessor.features.probe.ToolchainProbeFunction;
import org.kconfig4j.frontend.preprocessor.features.report.ErrorFunction;
import org.kconfig4j.frontend.preprocessor.features.report.ErrorIfFunction;
import org.kconfig4j.frontend.preprocessor.features.report.InfoFunction;
import org.kconfig4j.frontend.preprocessor.features.report.WarningIfFunction;
import org.kconfig4j.frontend.preprocessor.features.shell.ExitStatusFunction;
import org.kconfig4j.frontend.preprocessor.features.shell.IfSuccessFunction;
import org.kconfig4j.frontend.preprocessor.features.shell.ShellFunction;
import org.kconfig4j.frontend.preprocessor.features.snippet.SnippetFunction;
import org.kconfig4j.host.SnippetEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry for preprocessor functions.
 * Maps function names (e.g., "shell", "cc-option") to their implementations and argument bounds.
 */
public class MacroFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(MacroFunctionRegistry.class);

    /** Marks a function that takes any number of arguments above its minimum. */
    public static final int UNBOUNDED = -1;

    /**
     * A registered function.
     *
     * @param name     The name used in {@code $(name,...)}.
     * @param function The implementation.
     * @param minArgs  The minimum argument count.
     * @param maxArgs  The maximum argument count, or {@link #UNBOUNDED}.
     */
    public record Entry(String name, IMacroFunction function, int minArgs, int maxArgs) {

        public boolean accepts(int argCount) {
            return argCount >= minArgs && (maxArgs == UNBOUNDED || argCount <= maxArgs);
        }

        /**
         * @return The expected argument count as shown in error messages: {@code 2}, {@code 1 or more}, {@code 1-3}.
         */
        public String expectedArgs() {
            if (minArgs == maxArgs) {
                return String.valueOf(minArgs);
            }
            if (maxArgs == UNBOUNDED) {
                return minArgs + " or more";
            }
            return minArgs + "-" + maxArgs;
        }
    }

    private final Map<String, Entry> functions = new HashMap<>();

    /**
     * Registers a function, replacing any function of the same name.
     */
    public void register(String name, IMacroFunction function, int minArgs, int maxArgs) {
        functions.put(name, new Entry(name, function, minArgs, maxArgs));
    }

    /**
     * Looks up a function.
     * @param name The function name.
     * @return The entry, or empty if no function has that name.
     */
    public Optional<Entry> get(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Map<String, Entry> getAll() {
        return Collections.unmodifiableMap(functions);
    }

    public void registerProvider(MacroFunctionProvider provider) {
        provider.registerFunctions(this);
    }

    /**
     * Registers a snippet-evaluating function. It maps success to {@code y} and failure to {@code n}.
     *
     * @param name      The function name, conventionally {@code python}.
     * @param evaluator The evaluator.
     */
    public void registerSnippetEvaluator(String name, SnippetEvaluator evaluator) {
        register(name, new SnippetFunction(evaluator), 1, 1);
    }

    /**
     * Creates a registry with all built-in functions, plus those of every
     * {@link MacroFunctionProvider} found on the class path.
     * @return A new registry instance.
     */
    public static MacroFunctionRegistry initialize() {
        MacroFunctionRegistry registry = new MacroFunctionRegistry();
        registry.register("info", new InfoFunction(), 1, 1);
        registry.register("warning-if", new WarningIfFunction(), 2, 2);
        registry.register("error-if", new ErrorIfFunction(), 2, 2);
        registry.register("error", new ErrorFunction(), 1, 1);
        registry.register("filename", new FilenameFunction(), 0, 0);
        registry.register("lineno", new LinenoFunction(), 0, 0);
        registry.register("shell", new ShellFunction(), 1, 1);
        registry.register("success", new ExitStatusFunction(true), 1, 1);
        registry.register("failure", new ExitStatusFunction(false), 1, 1);
        registry.register("if-success", new IfSuccessFunction(), 3, 3);
        for (ToolchainProbe probe : ToolchainProbe.values()) {
            registry.register(probe.functionName(), new ToolchainProbeFunction(probe), 1, 1);
        }
        registry.register("cc-option-bit", new CcOptionBitFunction(), 1, 1);

        for (MacroFunctionProvider provider : ServiceLoader.load(MacroFunctionProvider.class)) {
            log.debug("Registering preprocessor functions from {}", provider.getClass().getName());
            registry.registerProvider(provider);
        }
        return registry;
    }
}

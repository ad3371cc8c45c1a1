package org.kconfig4j.frontend.preprocessor;

import java.util.List;

/**
 * A function callable from Kconfig files as {@code $(name,arg1,arg2,...)}.
 * Built-in functions and functions supplied by a {@link MacroFunctionProvider} implement the same contract.
 */
@FunctionalInterface
public interface IMacroFunction {

    /**
     * Computes the expansion of a call.
     *
     * @param context The preprocessor state: current location, diagnostics and host capabilities.
     * @param args    The expanded arguments, without the function name. The count has already
     *                been checked against the registered bounds.
     * @return The text the call expands to.
     */
    String invoke(PreProcessorContext context, List<String> args);
}

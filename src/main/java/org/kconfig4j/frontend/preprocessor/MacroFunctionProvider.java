package org.kconfig4j.frontend.preprocessor;

/**
 * Service provider interface for user-defined preprocessor functions.
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} through
 * {@code META-INF/services/org.kconfig4j.frontend.preprocessor.MacroFunctionProvider}
 * and can also be passed to {@link MacroFunctionRegistry#registerProvider} directly.
 */
public interface MacroFunctionProvider {

    /**
     * Registers this provider's functions.
     */
    void registerFunctions(MacroFunctionRegistry registry);
}

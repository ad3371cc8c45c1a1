package org.kconfig4j.frontend.preprocessor;

import java.util.Locale;

/**
 * Registered through {@code META-INF/services} to check provider discovery.
 */
public class UpperCaseFunctionProvider implements MacroFunctionProvider {

    static final String NAME = "upper";

    @Override
    public void registerFunctions(MacroFunctionRegistry registry) {
        registry.register(NAME, (context, args) -> args.get(0).toUpperCase(Locale.ROOT), 1, 1);
    }
}

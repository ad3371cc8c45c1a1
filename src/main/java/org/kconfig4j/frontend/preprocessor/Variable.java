package org.kconfig4j.frontend.preprocessor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A preprocessor variable, e.g. {@code foo := bar}. Variables referenced with arguments,
 * {@code $(foo,a,b)}, act as user-defined functions and see their arguments as {@code $(1)}, {@code $(2)}, ...
 */
public final class Variable {

    private final PreProcessor preProcessor;
    private final String name;
    private String value = "";
    private boolean recursive;
    private int expansionDepth;

    Variable(PreProcessor preProcessor, String name) {
        this.preProcessor = preProcessor;
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return The value as stored: unexpanded for recursive ({@code =}) variables,
     *     already expanded for immediate ({@code :=}) ones.
     */
    public String getValue() {
        return value;
    }

    void setValue(String value) {
        this.value = value;
    }

    public boolean isRecursive() {
        return recursive;
    }

    void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    int getExpansionDepth() {
        return expansionDepth;
    }

    void enter() {
        expansionDepth++;
    }

    void leave() {
        expansionDepth--;
    }

    /**
     * @return The fully expanded value with no arguments.
     */
    public String expandedValue() {
        return expandedValue(new String[0]);
    }

    /**
     * Expands the variable as if called as {@code $(name,args...)}.
     */
    public String expandedValue(String... args) {
        List<String> call = new ArrayList<>();
        call.add(name);
        call.addAll(Arrays.asList(args));
        return preProcessor.functionValue(call);
    }

    public String describe() {
        return "<variable " + name + ", " + (recursive ? "recursive" : "immediate") + ", value '" + value + "'>";
    }

    @Override
    public String toString() {
        return describe();
    }
}

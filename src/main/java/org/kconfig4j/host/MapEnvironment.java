package org.kconfig4j.host;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A fixed, in-memory environment, used for embedding and in tests.
 */
public class MapEnvironment implements Environment {

    private final Map<String, String> variables;

    public MapEnvironment(Map<String, String> variables) {
        this.variables = new HashMap<>(variables);
    }

    public MapEnvironment() {
        this(Map.of());
    }

    public MapEnvironment with(String name, String value) {
        variables.put(name, value);
        return this;
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(variables.get(name));
    }
}

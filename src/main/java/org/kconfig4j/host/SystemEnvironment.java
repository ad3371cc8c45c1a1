package org.kconfig4j.host;

import java.util.Optional;

/**
 * The process environment.
 */
public class SystemEnvironment implements Environment {

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(System.getenv(name));
    }

    @Override
    public String unameRelease() {
        return System.getProperty("os.version", "");
    }
}

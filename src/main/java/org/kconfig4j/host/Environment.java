package org.kconfig4j.host;

import java.util.Optional;

/**
 * Read access to environment variables.
 */
public interface Environment {

    Optional<String> get(String name);

    /**
     * The kernel release substituted for {@code $UNAME_RELEASE}. Defaults to the
     * {@code UNAME_RELEASE} variable.
     */
    default String unameRelease() {
        return get("UNAME_RELEASE").orElse("");
    }
}

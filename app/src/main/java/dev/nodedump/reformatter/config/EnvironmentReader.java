package dev.nodedump.reformatter.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * The value for {@code key}, trimmed, if present and not blank.
     */
    default Optional<String> nonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    /**
     * Reads the host process environment.
     */
    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}

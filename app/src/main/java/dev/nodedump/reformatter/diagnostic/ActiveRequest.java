package dev.nodedump.reformatter.diagnostic;

import java.util.Optional;

/**
 * Text of the request currently being served, reported by fatal diagnostics.
 */
public final class ActiveRequest {

    private static volatile String current;

    private ActiveRequest() {
    }

    public static void set(String requestText) {
        current = requestText;
    }

    public static void clear() {
        current = null;
    }

    public static Optional<String> current() {
        return Optional.ofNullable(current);
    }
}

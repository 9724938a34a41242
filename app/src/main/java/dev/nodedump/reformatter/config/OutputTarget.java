package dev.nodedump.reformatter.config;

/**
 * Where formatted dumps are written.
 */
public enum OutputTarget {
    CONSOLE,
    LOG;

    public static OutputTarget from(String raw) {
        if (raw == null || raw.isBlank()) {
            return CONSOLE;
        }
        for (OutputTarget target : values()) {
            if (target.name().equalsIgnoreCase(raw.trim())) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unsupported output target: " + raw);
    }
}

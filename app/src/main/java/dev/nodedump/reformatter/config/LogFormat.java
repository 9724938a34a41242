package dev.nodedump.reformatter.config;

import java.util.Locale;

/**
 * Supported log output formats.
 */
public enum LogFormat {
    TEXT,
    JSON;

    public static LogFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "text", "plain" -> TEXT;
            case "json" -> JSON;
            default -> throw new IllegalArgumentException("Unsupported log format: " + raw);
        };
    }
}

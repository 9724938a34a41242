package dev.nodedump.reformatter.display;

/**
 * How a dump is laid out for display.
 */
public enum DisplayMode {
    /** Word-wrapped at the line width. */
    SIMPLE,
    /** Indented by nesting markers. */
    PRETTY;

    public static DisplayMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return SIMPLE;
        }
        for (DisplayMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported display mode: " + raw);
    }
}

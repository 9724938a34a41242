package dev.nodedump.reformatter.format;

/**
 * Structural role of a dump character.
 */
public enum MarkerCategory {
    OPEN_BLOCK,
    CLOSE_BLOCK,
    OPEN_GROUP,
    CLOSE_GROUP,
    FIELD_SEPARATOR,
    TEXT;

    public static MarkerCategory of(char ch) {
        return switch (ch) {
            case '{' -> OPEN_BLOCK;
            case '}' -> CLOSE_BLOCK;
            case '(' -> OPEN_GROUP;
            case ')' -> CLOSE_GROUP;
            case ':' -> FIELD_SEPARATOR;
            default -> TEXT;
        };
    }
}

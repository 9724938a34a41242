package dev.nodedump.reformatter.format;

/**
 * Width and indentation limits shared by the dump formatters.
 */
public record FormatSettings(int maxWidth, int indentStep, int maxIndent) {

    public static final int DEFAULT_MAX_WIDTH = 78;
    public static final int DEFAULT_INDENT_STEP = 3;
    public static final int DEFAULT_MAX_INDENT = 60;

    public FormatSettings {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be greater than zero");
        }
        if (indentStep <= 0) {
            throw new IllegalArgumentException("indentStep must be greater than zero");
        }
        if (maxIndent < 0) {
            throw new IllegalArgumentException("maxIndent must be zero or greater");
        }
        if (maxIndent % indentStep != 0) {
            throw new IllegalArgumentException("maxIndent must be a multiple of indentStep");
        }
        if (maxIndent >= maxWidth) {
            throw new IllegalArgumentException("maxIndent must leave room for a marker within maxWidth");
        }
    }

    public static FormatSettings defaults() {
        return new FormatSettings(DEFAULT_MAX_WIDTH, DEFAULT_INDENT_STEP, DEFAULT_MAX_INDENT);
    }

    /**
     * Settings for the given width with the default indent step and the deepest indent cap that still fits.
     */
    public static FormatSettings forWidth(int maxWidth) {
        return new FormatSettings(maxWidth, DEFAULT_INDENT_STEP, fittingMaxIndent(maxWidth, DEFAULT_INDENT_STEP));
    }

    /**
     * Largest indent not above {@link #DEFAULT_MAX_INDENT} that is a multiple of {@code indentStep} and below
     * {@code maxWidth}.
     */
    public static int fittingMaxIndent(int maxWidth, int indentStep) {
        if (maxWidth <= 0 || indentStep <= 0) {
            return 0;
        }
        int fitting = ((maxWidth - 1) / indentStep) * indentStep;
        int cap = (DEFAULT_MAX_INDENT / indentStep) * indentStep;
        return Math.min(fitting, cap);
    }
}

package dev.nodedump.reformatter.format;

/**
 * Nesting depth of the pretty printer and the column it maps to.
 */
public record IndentState(int level, int indentStep, int maxIndent) {

    public IndentState {
        if (level < 0) {
            throw new IllegalArgumentException("level must be zero or greater");
        }
    }

    static IndentState initial(FormatSettings settings) {
        return new IndentState(0, settings.indentStep(), settings.maxIndent());
    }

    public int distance() {
        return (int) Math.min((long) level * indentStep, maxIndent);
    }

    public IndentState indent() {
        return new IndentState(level + 1, indentStep, maxIndent);
    }

    /**
     * One level shallower; stays at level zero for an unmatched closing marker.
     */
    public IndentState outdent() {
        if (level == 0) {
            return this;
        }
        return new IndentState(level - 1, indentStep, maxIndent);
    }
}

package dev.nodedump.reformatter.format;

import java.util.List;
import java.util.Objects;

/**
 * Lines produced by a dump formatter, in output order.
 */
public record FormattedDump(List<String> lines) {

    public FormattedDump {
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    /**
     * The lines as one block, each terminated by a line feed.
     */
    public String text() {
        StringBuilder builder = new StringBuilder();
        for (String line : lines) {
            builder.append(line).append('\n');
        }
        return builder.toString();
    }
}

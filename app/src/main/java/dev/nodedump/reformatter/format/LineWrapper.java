package dev.nodedump.reformatter.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Wraps a dump at the space nearest the line width, without regard to its structure.
 *
 * <p>A token longer than the width is split at the width, the only case in which a line does not end on a word
 * boundary.
 */
public class LineWrapper implements DumpFormatter {

    private final int maxWidth;

    public LineWrapper() {
        this(FormatSettings.DEFAULT_MAX_WIDTH);
    }

    public LineWrapper(int maxWidth) {
        this.maxWidth = requirePositiveWidth(maxWidth);
    }

    public int maxWidth() {
        return maxWidth;
    }

    @Override
    public FormattedDump format(String dump) {
        return wrap(dump, maxWidth);
    }

    public FormattedDump wrap(String dump, int maxWidth) {
        Objects.requireNonNull(dump, "dump");
        requirePositiveWidth(maxWidth);

        List<String> lines = new ArrayList<>();
        LineBuffer line = new LineBuffer(maxWidth);
        int length = dump.length();
        int start = 0;
        for (;;) {
            line.clear();
            int cursor = start;
            while (!line.isFull() && cursor < length) {
                line.append(dump.charAt(cursor++));
            }
            if (cursor == length) {
                if (!line.isEmpty()) {
                    lines.add(line.contents());
                }
                break;
            }
            if (dump.charAt(cursor) == ' ') {
                // break at the adjacent space and drop it
                start = cursor + 1;
            } else {
                int space = line.lastIndexOf(' ', 0);
                if (space > 0) {
                    // the partial token after the space is re-read for the next line
                    line.truncate(space);
                    start += space + 1;
                } else {
                    start = cursor;
                }
            }
            lines.add(line.contents());
        }
        return new FormattedDump(lines);
    }

    private static int requirePositiveWidth(int maxWidth) {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be greater than zero");
        }
        return maxWidth;
    }
}

package dev.nodedump.reformatter.format;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Indents a dump according to its block, group and field markers.
 *
 * <p>Blocks ({@code { }}) indent their contents by one step, capped at the maximum indent. A block opener, a block
 * closer and a field separator ({@code :}) each start a new line; a group closer ({@code )}) ends its line unless
 * another group closer follows. Lines that reach the width are broken there regardless of content. Unbalanced
 * closers are tolerated: the indent never drops below column zero.
 */
public class StructuralPrettyPrinter implements DumpFormatter {

    private final FormatSettings settings;

    public StructuralPrettyPrinter() {
        this(FormatSettings.defaults());
    }

    public StructuralPrettyPrinter(FormatSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public FormatSettings settings() {
        return settings;
    }

    @Override
    public FormattedDump format(String dump) {
        return prettyPrint(dump);
    }

    public FormattedDump prettyPrint(String dump) {
        Objects.requireNonNull(dump, "dump");
        return new Pass(dump).run();
    }

    /**
     * State of a single formatting call.
     */
    private final class Pass {

        private final String dump;
        private final List<String> lines = new ArrayList<>();
        private final LineBuffer line = new LineBuffer(settings.maxWidth());
        private IndentState indent = IndentState.initial(settings);
        private int cursor;

        private Pass(String dump) {
            this.dump = dump;
        }

        FormattedDump run() {
            line.reset(indent.distance());
            while (cursor < dump.length()) {
                if (line.isFull()) {
                    emitLine();
                    line.reset(indent.distance());
                }
                char ch = dump.charAt(cursor);
                switch (MarkerCategory.of(ch)) {
                    case CLOSE_BLOCK -> closeBlock(ch);
                    case CLOSE_GROUP -> closeGroup(ch);
                    case OPEN_BLOCK -> openBlock(ch);
                    case FIELD_SEPARATOR -> fieldSeparator(ch);
                    case OPEN_GROUP, TEXT -> line.append(ch);
                }
                cursor++;
            }
            if (!line.isEmpty()) {
                emitLine();
            }
            return new FormattedDump(lines);
        }

        private void closeBlock(char marker) {
            if (hasContent()) {
                emitLine();
            }
            // the closer sits at the depth of the block it closes
            line.reset(indent.distance());
            line.append(marker);
            emitLine();
            indent = indent.outdent();
            line.reset(indent.distance());
            skipFollowingSpaces();
        }

        private void closeGroup(char marker) {
            line.append(marker);
            if (!nextIs(marker)) {
                emitLine();
                line.reset(indent.distance());
                skipFollowingSpaces();
            }
        }

        private void openBlock(char marker) {
            if (hasContent()) {
                emitLine();
            }
            indent = indent.indent();
            line.reset(indent.distance());
            line.append(marker);
        }

        private void fieldSeparator(char marker) {
            if (hasContent()) {
                emitLine();
            }
            line.reset(indent.distance());
            line.append(marker);
        }

        private boolean hasContent() {
            return line.length() > indent.distance();
        }

        private boolean nextIs(char ch) {
            return cursor + 1 < dump.length() && dump.charAt(cursor + 1) == ch;
        }

        private void skipFollowingSpaces() {
            while (nextIs(' ')) {
                cursor++;
            }
        }

        private void emitLine() {
            lines.add(line.contents());
        }
    }
}

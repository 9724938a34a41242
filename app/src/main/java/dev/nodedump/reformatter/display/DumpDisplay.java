package dev.nodedump.reformatter.display;

import dev.nodedump.reformatter.format.DumpFormatter;
import dev.nodedump.reformatter.format.FormatSettings;
import dev.nodedump.reformatter.format.LineWrapper;
import dev.nodedump.reformatter.format.StructuralPrettyPrinter;
import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Formats dumps in the requested mode and hands the result to a console stream or the log.
 */
public class DumpDisplay {

    private static final Logger LOGGER = LoggerFactory.getLogger(DumpDisplay.class);

    private final Map<DisplayMode, DumpFormatter> formatters = new EnumMap<>(DisplayMode.class);

    public DumpDisplay() {
        this(FormatSettings.defaults());
    }

    public DumpDisplay(FormatSettings settings) {
        this(new LineWrapper(settings.maxWidth()), new StructuralPrettyPrinter(settings));
    }

    public DumpDisplay(DumpFormatter simpleFormatter, DumpFormatter prettyFormatter) {
        formatters.put(DisplayMode.SIMPLE, Objects.requireNonNull(simpleFormatter, "simpleFormatter"));
        formatters.put(DisplayMode.PRETTY, Objects.requireNonNull(prettyFormatter, "prettyFormatter"));
    }

    public String render(String dump, DisplayMode mode) {
        Objects.requireNonNull(mode, "mode");
        return formatters.get(mode).format(dump).text();
    }

    /**
     * Writes the formatted dump followed by an empty line.
     */
    public void print(String dump, DisplayMode mode, PrintStream out) {
        Objects.requireNonNull(out, "out");
        String text = render(dump, mode);
        out.print(text);
        out.print('\n');
        out.flush();
    }

    /**
     * Sends the formatted dump to the log as one record titled {@code title}.
     */
    public void log(Level level, String title, String dump, DisplayMode mode) {
        Objects.requireNonNull(level, "level");
        String text = render(dump, mode);
        if (text.endsWith("\n")) {
            text = text.substring(0, text.length() - 1);
        }
        LOGGER.atLevel(level)
                .addKeyValue("title", title)
                .addKeyValue("mode", mode.name().toLowerCase(Locale.ROOT))
                .log("{}:\n{}", title, text);
    }
}

package dev.nodedump.reformatter.cli;

import dev.nodedump.reformatter.config.LogFormat;
import dev.nodedump.reformatter.config.OutputTarget;
import dev.nodedump.reformatter.diagnostic.BuildInfo;
import dev.nodedump.reformatter.display.DisplayMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "node-dump-reformatter", mixinStandardHelpOptions = true,
        versionProvider = CliArguments.ManifestVersionProvider.class,
        description = "Reformats a flat node dump for terminals and logs")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "Dump file to read (default: standard input)")
    private Path inputFile;

    @CommandLine.Option(names = "--mode", converter = DisplayModeConverter.class, description = "Layout: simple or pretty")
    private DisplayMode mode;

    @CommandLine.Option(names = "--width", description = "Maximum line width", paramLabel = "COLUMNS")
    private Integer maxWidth;

    @CommandLine.Option(names = "--indent-step", description = "Columns per nesting level (pretty mode)", paramLabel = "COLUMNS")
    private Integer indentStep;

    @CommandLine.Option(names = "--max-indent", description = "Deepest indentation (pretty mode)", paramLabel = "COLUMNS")
    private Integer maxIndent;

    @CommandLine.Option(names = "--output", converter = OutputTargetConverter.class, description = "Destination: console or log")
    private OutputTarget output;

    @CommandLine.Option(names = "--title", description = "Title of the log record when writing to the log", paramLabel = "TEXT")
    private String title;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Enable debug logging")
    private boolean verbose;

    @CommandLine.Option(names = "--abort-on-fatal", description = "Abort instead of exiting when a fatal error is reported")
    private boolean abortOnFatal;

    public Path inputFile() {
        return inputFile;
    }

    public DisplayMode mode() {
        return mode;
    }

    public Integer maxWidth() {
        return maxWidth;
    }

    public Integer indentStep() {
        return indentStep;
    }

    public Integer maxIndent() {
        return maxIndent;
    }

    public OutputTarget output() {
        return output;
    }

    public String title() {
        return title;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean abortOnFatal() {
        return abortOnFatal;
    }

    public static class ManifestVersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"node-dump-reformatter " + BuildInfo.version()};
        }
    }
}

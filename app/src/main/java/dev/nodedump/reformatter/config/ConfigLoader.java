package dev.nodedump.reformatter.config;

import dev.nodedump.reformatter.cli.CliArguments;
import dev.nodedump.reformatter.display.DisplayMode;
import dev.nodedump.reformatter.format.FormatSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_MODE = "REFORMAT_MODE";
    static final String ENV_MAX_WIDTH = "REFORMAT_MAX_WIDTH";
    static final String ENV_INDENT_STEP = "REFORMAT_INDENT_STEP";
    static final String ENV_MAX_INDENT = "REFORMAT_MAX_INDENT";
    static final String ENV_OUTPUT = "REFORMAT_OUTPUT";
    static final String ENV_TITLE = "REFORMAT_TITLE";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "REFORMAT_VERBOSE";
    static final String ENV_ABORT_ON_FATAL = "REFORMAT_ABORT_ON_FATAL";

    static final String DEFAULT_TITLE = "node dump";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        DisplayMode displayMode = resolve(arguments.mode(), ENV_MODE, DisplayMode::from, DisplayMode.SIMPLE);
        OutputTarget outputTarget = resolve(arguments.output(), ENV_OUTPUT, OutputTarget::from, OutputTarget.CONSOLE);
        LogFormat logFormat = resolve(arguments.logFormat(), ENV_LOG_FORMAT, LogFormat::from, LogFormat.TEXT);
        String title = resolve(arguments.title(), ENV_TITLE, Function.identity(), DEFAULT_TITLE);

        FormatSettings formatSettings = resolveFormatSettings(arguments);

        boolean verbose = resolveFlag(arguments.verbose(), ENV_VERBOSE);
        boolean abortOnFatal = resolveFlag(arguments.abortOnFatal(), ENV_ABORT_ON_FATAL);
        Optional<Path> inputFile = Optional.ofNullable(arguments.inputFile());

        return new Config(displayMode, formatSettings, outputTarget, title, logFormat, verbose, abortOnFatal, inputFile);
    }

    private FormatSettings resolveFormatSettings(CliArguments arguments) {
        int maxWidth = resolveInteger(arguments.maxWidth(), ENV_MAX_WIDTH, "--width")
                .orElse(FormatSettings.DEFAULT_MAX_WIDTH);
        int indentStep = resolveInteger(arguments.indentStep(), ENV_INDENT_STEP, "--indent-step")
                .orElse(FormatSettings.DEFAULT_INDENT_STEP);
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("--width must be greater than zero");
        }
        if (indentStep <= 0) {
            throw new IllegalArgumentException("--indent-step must be greater than zero");
        }
        int maxIndent = resolveInteger(arguments.maxIndent(), ENV_MAX_INDENT, "--max-indent")
                .orElseGet(() -> FormatSettings.fittingMaxIndent(maxWidth, indentStep));
        return new FormatSettings(maxWidth, indentStep, maxIndent);
    }

    private <T> T resolve(T cliValue, String envKey, Function<String, T> parser, T defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.nonBlank(envKey)
                .map(parser)
                .orElse(defaultValue);
    }

    private Optional<Integer> resolveInteger(Integer cliValue, String envKey, String optionName) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.nonBlank(envKey)
                .map(raw -> parseInteger(raw, optionName + " (" + envKey + ")"));
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.nonBlank(envKey)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parseInteger(String raw, String name) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer: " + raw, ex);
        }
    }
}

package dev.nodedump.reformatter.config;

import dev.nodedump.reformatter.display.DisplayMode;
import dev.nodedump.reformatter.format.FormatSettings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        DisplayMode displayMode,
        FormatSettings formatSettings,
        OutputTarget outputTarget,
        String title,
        LogFormat logFormat,
        boolean verbose,
        boolean abortOnFatal,
        Optional<Path> inputFile
) {

    public Config {
        Objects.requireNonNull(displayMode, "displayMode");
        Objects.requireNonNull(formatSettings, "formatSettings");
        Objects.requireNonNull(outputTarget, "outputTarget");
        Objects.requireNonNull(logFormat, "logFormat");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        inputFile = inputFile == null ? Optional.empty() : inputFile;
    }
}

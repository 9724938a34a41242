package dev.nodedump.reformatter.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.nodedump.reformatter.cli.CliArguments;
import dev.nodedump.reformatter.display.DisplayMode;
import dev.nodedump.reformatter.format.FormatSettings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "pretty",
                "--width", "40",
                "--indent-step", "4",
                "--max-indent", "20",
                "--output", "log",
                "--title", "plan",
                "--log-format", "json",
                "--verbose",
                "--abort-on-fatal",
                "dump.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.displayMode()).isEqualTo(DisplayMode.PRETTY);
        assertThat(config.formatSettings()).isEqualTo(new FormatSettings(40, 4, 20));
        assertThat(config.outputTarget()).isEqualTo(OutputTarget.LOG);
        assertThat(config.title()).isEqualTo("plan");
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.verbose()).isTrue();
        assertThat(config.abortOnFatal()).isTrue();
        assertThat(config.inputFile()).contains(Path.of("dump.txt"));
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_MODE, "PRETTY");
        envValues.put(ConfigLoader.ENV_MAX_WIDTH, " 20 ");
        envValues.put(ConfigLoader.ENV_OUTPUT, "log");
        envValues.put(ConfigLoader.ENV_TITLE, "rewritten");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "plain");
        envValues.put(ConfigLoader.ENV_VERBOSE, "1");
        envValues.put(ConfigLoader.ENV_ABORT_ON_FATAL, "TRUE");

        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(envValues);
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.displayMode()).isEqualTo(DisplayMode.PRETTY);
        assertThat(config.formatSettings()).isEqualTo(new FormatSettings(20, 3, 18));
        assertThat(config.outputTarget()).isEqualTo(OutputTarget.LOG);
        assertThat(config.title()).isEqualTo("rewritten");
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isTrue();
        assertThat(config.abortOnFatal()).isTrue();
        assertThat(config.inputFile()).isEmpty();
        assertThat(environmentReader.requestedKeys())
                .contains(ConfigLoader.ENV_MAX_WIDTH, ConfigLoader.ENV_INDENT_STEP, ConfigLoader.ENV_MAX_INDENT);
    }

    @Test
    void usesDefaultsWhenNothingIsConfigured() {
        Config config = new ConfigLoader(key -> Optional.empty()).load(CommandLine.populateCommand(new CliArguments()));

        assertThat(config.displayMode()).isEqualTo(DisplayMode.SIMPLE);
        assertThat(config.formatSettings()).isEqualTo(FormatSettings.defaults());
        assertThat(config.outputTarget()).isEqualTo(OutputTarget.CONSOLE);
        assertThat(config.title()).isEqualTo(ConfigLoader.DEFAULT_TITLE);
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
        assertThat(config.verbose()).isFalse();
        assertThat(config.abortOnFatal()).isFalse();
    }

    @Test
    void cliValuesOverrideEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MODE, "pretty",
                ConfigLoader.ENV_MAX_WIDTH, "wide"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--mode", "simple",
                "--width", "30");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.displayMode()).isEqualTo(DisplayMode.SIMPLE);
        assertThat(config.formatSettings().maxWidth()).isEqualTo(30);
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_MODE, ConfigLoader.ENV_MAX_WIDTH);
    }

    @Test
    void nonNumericEnvironmentWidthCausesValidationError() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_MAX_WIDTH, "wide"));

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader)
                .load(CommandLine.populateCommand(new CliArguments())));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--width (REFORMAT_MAX_WIDTH) must be an integer: wide");
    }

    @Test
    void inconsistentIndentSettingsCauseValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--indent-step", "4",
                "--max-indent", "10");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiple of indentStep");
    }

    @Test
    void nonPositiveWidthCausesValidationError() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--width", "0");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--width must be greater than zero");
    }

    @Test
    void parsesOutputTargetsAndLogFormats() {
        assertThat(OutputTarget.from("Log")).isEqualTo(OutputTarget.LOG);
        assertThat(OutputTarget.from(" ")).isEqualTo(OutputTarget.CONSOLE);
        assertThat(LogFormat.from("JSON")).isEqualTo(LogFormat.JSON);
        assertThat(catchThrowable(() -> LogFormat.from("xml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported log format: xml");
        assertThat(catchThrowable(() -> OutputTarget.from("file")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported output target: file");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}

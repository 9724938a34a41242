package dev.nodedump.reformatter.cli;

import dev.nodedump.reformatter.config.Config;
import dev.nodedump.reformatter.config.ConfigLoader;
import dev.nodedump.reformatter.config.EnvironmentReader;
import dev.nodedump.reformatter.diagnostic.ActiveRequest;
import dev.nodedump.reformatter.diagnostic.FatalErrorHandler;
import dev.nodedump.reformatter.display.DumpDisplay;
import dev.nodedump.reformatter.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and dump display.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_READ_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Consumer<Config> fatalHandlerInstaller;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), System.in, System.out, System.err,
                config -> new FatalErrorHandler(config.abortOnFatal()).install());
    }

    CliApplication(ConfigLoader configLoader, InputStream in, PrintStream out, PrintStream err,
                   Consumer<Config> fatalHandlerInstaller) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.fatalHandlerInstaller = Objects.requireNonNull(fatalHandlerInstaller, "fatalHandlerInstaller");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        fatalHandlerInstaller.accept(config);
        ActiveRequest.set(commandLine.getCommandName() + " " + String.join(" ", args));
        // an escaping failure keeps the request for the uncaught exception handler
        try {
            String dump = readDump(config);
            LOGGER.debug("Formatting {} characters in {} mode (width={})",
                    dump.length(), config.displayMode(), config.formatSettings().maxWidth());
            DumpDisplay display = new DumpDisplay(config.formatSettings());
            switch (config.outputTarget()) {
                case CONSOLE -> display.print(dump, config.displayMode(), out);
                case LOG -> display.log(Level.INFO, config.title(), dump, config.displayMode());
            }
            ActiveRequest.clear();
            return 0;
        } catch (UncheckedIOException ex) {
            ActiveRequest.clear();
            LOGGER.error("Failed to read node dump: {}", ex.getMessage());
            return EXIT_READ_FAILURE;
        }
    }

    private String readDump(Config config) {
        return normalize(config.inputFile()
                .map(CliApplication::readFile)
                .orElseGet(this::readStandardInput));
    }

    private static String readFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + path, ex);
        }
    }

    private String readStandardInput() {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read standard input", ex);
        }
    }

    /**
     * A dump is a single line: trailing line terminators are dropped and embedded ones read as spaces.
     */
    static String normalize(String raw) {
        int end = raw.length();
        while (end > 0 && (raw.charAt(end - 1) == '\n' || raw.charAt(end - 1) == '\r')) {
            end--;
        }
        return raw.substring(0, end)
                .replace("\r\n", " ")
                .replace('\n', ' ')
                .replace('\r', ' ');
    }
}

package dev.nodedump.reformatter.cli;

import dev.nodedump.reformatter.config.LogFormat;
import picocli.CommandLine;

/**
 * Accepts {@code text}, {@code plain} or {@code json} for {@code --log-format}.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        return LogFormat.from(value);
    }
}

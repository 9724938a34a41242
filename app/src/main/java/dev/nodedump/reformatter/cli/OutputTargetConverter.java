package dev.nodedump.reformatter.cli;

import dev.nodedump.reformatter.config.OutputTarget;
import picocli.CommandLine;

public class OutputTargetConverter implements CommandLine.ITypeConverter<OutputTarget> {

    @Override
    public OutputTarget convert(String value) {
        return OutputTarget.from(value);
    }
}

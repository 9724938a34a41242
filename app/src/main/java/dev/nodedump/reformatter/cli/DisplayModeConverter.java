package dev.nodedump.reformatter.cli;

import dev.nodedump.reformatter.display.DisplayMode;
import picocli.CommandLine;

public class DisplayModeConverter implements CommandLine.ITypeConverter<DisplayMode> {

    @Override
    public DisplayMode convert(String value) {
        return DisplayMode.from(value);
    }
}

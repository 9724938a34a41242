package dev.nodedump.reformatter.format;

/**
 * Re-renders a flat node dump for human consumption.
 */
public interface DumpFormatter {

    FormattedDump format(String dump);
}

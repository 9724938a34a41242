package dev.nodedump.reformatter.diagnostic;

/**
 * Version information taken from the jar manifest.
 */
public final class BuildInfo {

    static final String UNKNOWN_VERSION = "development";

    private BuildInfo() {
    }

    public static String version() {
        String version = BuildInfo.class.getPackage().getImplementationVersion();
        return version == null || version.isBlank() ? UNKNOWN_VERSION : version;
    }
}

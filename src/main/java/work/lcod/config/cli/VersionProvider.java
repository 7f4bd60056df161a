package work.lcod.config.cli;

import picocli.CommandLine;

/**
 * Reads name and version from the jar manifest; running from classes reports a development build.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEFAULT_TITLE = "lcod-config-resolver";

    @Override
    public String[] getVersion() {
        var pkg = Main.class.getPackage();
        String title = pkg.getImplementationTitle() != null ? pkg.getImplementationTitle() : DEFAULT_TITLE;
        String version = pkg.getImplementationVersion() != null ? pkg.getImplementationVersion() : "development";
        return new String[] { title + " " + version, "Java " + System.getProperty("java.version") };
    }
}

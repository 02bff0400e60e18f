package work.lcod.staging.cli;

import picocli.CommandLine;
import work.lcod.staging.defaults.MergeOptions;
import work.lcod.staging.target.Loaders;

/**
 * Reports the build version together with the target formats and defaults suffix it understands.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    @Override
    public String[] getVersion() {
        String version = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "lcod-stage " + (version != null ? version : "development"),
            "target formats: " + String.join(", ", Loaders.FORMATS),
            "defaults suffix: " + MergeOptions.DEFAULT_DEFAULTS_FILE_EXTENSION
        };
    }
}

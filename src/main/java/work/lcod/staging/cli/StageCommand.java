package work.lcod.staging.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.staging.api.LogLevel;
import work.lcod.staging.api.RunResult;
import work.lcod.staging.api.StagingConfiguration;
import work.lcod.staging.api.StagingRunner;
import work.lcod.staging.config.StagingManifestLoader;
import work.lcod.staging.defaults.MergeOptions;

@CommandLine.Command(
    name = "lcod-stage",
    description = "Generate merged properties and build one staging archive per target.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class StageCommand implements Callable<Integer> {
    /** Command line with the staging error handler installed; shared by {@link Main} and tests. */
    static CommandLine newCommandLine() {
        return new CommandLine(new StageCommand()).setExecutionExceptionHandler(new ShortErrorHandler());
    }

    @CommandLine.Option(
        names = {"-p", "--project-dir"},
        description = "Project directory holding src/main/{targets,defaults,templates,resources}.",
        defaultValue = "."
    )
    private String projectDir;

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Staging manifest (default: <project-dir>/staging.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--targets-dir",
        description = "Directory of target definition files (overrides the manifest).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String targetsDir;

    @CommandLine.Option(
        names = "--include-all-resources",
        arity = "0..1",
        description = "Stage every resource instead of only <name>.<target> variants."
    )
    private Boolean includeAllResources;

    @CommandLine.Option(names = "--sort", arity = "0..1", description = "Sort generated property lines.")
    private Boolean sort;

    @CommandLine.Option(names = "--trim", arity = "0..1", description = "Drop blank lines from generated properties.")
    private Boolean trim;

    @CommandLine.Option(names = "--structured", arity = "0..1", description = "Require generated property files to share one key set.")
    private Boolean structured;

    @CommandLine.Option(names = "--prepend", arity = "0..1", description = "Place template lines before the defaults.")
    private Boolean prepend;

    @CommandLine.Option(
        names = "--defaults-extension",
        description = "Suffix of defaults files (default: .defaults.vtl).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String defaultsExtension;

    @CommandLine.Option(names = "--strict", arity = "0..1", description = "Fail rendering on undefined context values.")
    private Boolean strict;

    @CommandLine.Option(names = "--dry-run", description = "Configure the stages without running them.")
    private boolean dryRun;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @Override
    public Integer call() {
        Path project = Paths.get(projectDir).toAbsolutePath().normalize();
        if (!Files.isDirectory(project)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Project directory not found: " + project);
        }
        Path manifest = config != null
            ? Paths.get(config).toAbsolutePath().normalize()
            : project.resolve(StagingManifestLoader.MANIFEST_FILE);
        if (config != null && !Files.isRegularFile(manifest)) {
            throw new CommandLine.ParameterException(new CommandLine(this), "Manifest not found: " + manifest);
        }

        StagingConfiguration configuration = applyOverrides(StagingManifestLoader.load(project, manifest));
        LogLevels.apply(configuration.logLevel());

        RunResult result = new StagingRunner().run(configuration);
        System.out.println(result.toPrettyJson());
        return result.exitCode();
    }

    /**
     * Applies the command-line flags over the manifest values.
     *
     * @throws CommandLine.ParameterException when a flag value is rejected
     */
    StagingConfiguration applyOverrides(StagingConfiguration.Builder builder) {
        try {
            return overrides(builder);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(new CommandLine(this), ex.getMessage(), ex);
        }
    }

    private StagingConfiguration overrides(StagingConfiguration.Builder builder) {
        StagingConfiguration loaded = builder.build();
        MergeOptions options = loaded.mergeOptions();
        MergeOptions.Builder merge = options.toBuilder();
        if (sort != null) {
            merge.sort(sort);
        }
        if (trim != null) {
            merge.trim(trim);
        }
        if (structured != null) {
            merge.structured(structured);
        }
        if (prepend != null) {
            merge.prepend(prepend);
        }
        if (defaultsExtension != null) {
            merge.defaultsFileExtension(defaultsExtension);
        }
        builder.mergeOptions(merge.build());
        if (targetsDir != null) {
            Path dir = loaded.layout().projectDir().resolve(targetsDir).normalize();
            builder.layout(loaded.layout().withTargetsDir(dir));
        } else {
            builder.layout(loaded.layout());
        }
        if (includeAllResources != null) {
            builder.includeAllResources(includeAllResources);
        }
        if (strict != null) {
            builder.strictRendering(strict);
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder.dryRun(dryRun).build();
    }
}

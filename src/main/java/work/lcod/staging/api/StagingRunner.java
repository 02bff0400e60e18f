package work.lcod.staging.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.artifact.ArtifactHandle;
import work.lcod.staging.defaults.PropertiesGenerator;
import work.lcod.staging.pipeline.AggregateStage;
import work.lcod.staging.pipeline.PipelineStageException;
import work.lcod.staging.pipeline.Stage;
import work.lcod.staging.pipeline.StageExecutor;
import work.lcod.staging.pipeline.StageOrchestrator;
import work.lcod.staging.pipeline.StagingContext;
import work.lcod.staging.render.PlaceholderRenderer;
import work.lcod.staging.target.Target;
import work.lcod.staging.target.TargetDiscovery;

/**
 * Public entry point for embedding the staging engine.
 *
 * <p>A run discovers the targets, generates the merged property files, configures the stages of
 * every target and, unless it is a dry run, executes them. Failures are reported through the
 * returned {@link RunResult}, never thrown.</p>
 */
public final class StagingRunner {
    private static final Logger log = LoggerFactory.getLogger(StagingRunner.class);
    static final String GENERATE_PROPERTIES = "generateProperties";

    public RunResult run(StagingConfiguration configuration) {
        var result = RunResult.builder(configuration.layout().projectDir());
        try {
            var targets = discoverTargets(configuration);
            result.targets(targets.keySet());
            result.generated(generateProperties(configuration));

            var context = createContext(configuration);
            new StageOrchestrator(context).configure(targets);
            result.stages(context.stages().stages().stream().map(Stage::name).collect(Collectors.toList()))
                .archives(context.artifactCache().artifacts().values().stream()
                    .map(ArtifactHandle::file)
                    .collect(Collectors.toList()))
                .publications(context.publications());

            if (configuration.dryRun()) {
                return result.planned();
            }
            result.executed(execute(context));
            return result.success();
        } catch (Exception ex) {
            log.error("Staging failed: {}", ex.getMessage());
            if (Boolean.getBoolean("lcod.debug")) {
                ex.printStackTrace();
            }
            return result.failure(ex);
        }
    }

    /** Discovered targets, overlaid with the targets declared in the configuration. */
    public Map<String, Target> discoverTargets(StagingConfiguration configuration) {
        var targets = new LinkedHashMap<String, Target>();
        Path targetsDir = configuration.layout().targetsDir();
        if (Files.isDirectory(targetsDir)) {
            targets.putAll(TargetDiscovery.discover(targetsDir, configuration.templates()));
        } else {
            log.warn("Targets directory not found, using declared targets only: {}", targetsDir);
        }
        targets.putAll(configuration.targets());
        return targets;
    }

    public List<Path> generateProperties(StagingConfiguration configuration) {
        var layout = configuration.layout();
        try {
            return PropertiesGenerator.mergeDefaults(
                layout.defaultsDir(),
                layout.templatesDir(),
                layout.generatedPropertiesDir(),
                configuration.mergeOptions());
        } catch (IOException ex) {
            throw new PipelineStageException(GENERATE_PROPERTIES, ex);
        }
    }

    public StagingContext createContext(StagingConfiguration configuration) {
        return StagingContext.builder()
            .layout(configuration.layout())
            .coordinates(configuration.coordinates())
            .includeAllResources(configuration.includeAllResources())
            .contextValues(configuration.contextValues())
            .renderer(new PlaceholderRenderer(configuration.strictRendering()))
            .build();
    }

    private List<String> execute(StagingContext context) {
        if (!context.stages().contains(AggregateStage.NAME)) {
            log.warn("No targets configured, nothing to stage");
            return List.of();
        }
        return new StageExecutor(context.stages()).execute(AggregateStage.NAME);
    }
}

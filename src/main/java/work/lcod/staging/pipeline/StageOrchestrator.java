package work.lcod.staging.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.artifact.ArtifactHandle;
import work.lcod.staging.artifact.Publication;
import work.lcod.staging.shared.StagingException;
import work.lcod.staging.target.Target;

/**
 * Builds the render, collect, archive and publish stages of each target.
 *
 * <p>Configuration is idempotent: stages are looked up by name before being created, and the
 * archive artifact and its publication go through the run's {@link work.lcod.staging.artifact.ArtifactCache}.
 * Calling {@link #configure(Map)} again with the same targets changes nothing.</p>
 */
public final class StageOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(StageOrchestrator.class);
    private static final String ARCHIVE_EXTENSION = "zip";

    private final StagingContext context;

    public StageOrchestrator(StagingContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public StagingContext context() {
        return context;
    }

    /**
     * Configures every target in iteration order. A failing target does not stop the others and
     * does not undo targets configured before it; once all targets were attempted the first failure
     * is rethrown with the remaining ones attached as suppressed.
     */
    public void configure(Map<String, Target> targets) {
        log.info("Configuring staging targets: {}", targets.keySet());
        List<StagingException> failures = new ArrayList<>();
        for (Target target : targets.values()) {
            try {
                configureTarget(target);
            } catch (StagingException ex) {
                log.error("Unable to configure target {}: {}", target.name(), ex.getMessage());
                failures.add(ex);
            }
        }
        if (!failures.isEmpty()) {
            StagingException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
    }

    public void configureTarget(Target target) {
        checkTarget(target);
        log.info("Configuring staging target {}: {}", target.name(), target.context().map(Map::keySet).orElse(null));
        RenderStage render = target.hasContext() ? createRenderStage(target) : null;
        CollectStage collect = createCollectStage(target, render);
        ArchiveStage archive = createArchiveStage(target, collect);
        ArtifactHandle artifact = createArtifact(target, archive);
        configurePublishing(target, artifact, archive);
        aggregate().dependsOn(StageKind.PUBLISH.stageName(target.name()));
    }

    void checkTarget(Target target) {
        if (target == null || !target.hasName()) {
            throw new InvalidTargetException(target);
        }
    }

    RenderStage createRenderStage(Target target) {
        return createStage(StageKind.RENDER.stageName(target.name()), RenderStage.class, () -> {
            var values = new LinkedHashMap<String, String>(context.contextValues());
            values.putAll(target.context().orElseThrow());
            return new RenderStage(
                target.name(),
                context.layout().generatedPropertiesDir(),
                context.layout().renderDir(target.name()),
                values,
                context.renderer());
        });
    }

    CollectStage createCollectStage(Target target, RenderStage render) {
        return createStage(StageKind.COLLECT.stageName(target.name()), CollectStage.class, () -> {
            var stage = new CollectStage(
                target.name(),
                context.layout().resourcesDir(),
                render == null ? null : render.outputDir(),
                context.layout().collectDir(target.name()),
                context.includeAllResources());
            if (render != null) {
                stage.dependsOn(render.name());
            }
            return stage;
        });
    }

    ArchiveStage createArchiveStage(Target target, CollectStage collect) {
        return createStage(StageKind.ARCHIVE.stageName(target.name()), ArchiveStage.class, () -> {
            Path archiveFile = context.layout().libsDir()
                .resolve(context.coordinates().archiveFileName(target.name(), ARCHIVE_EXTENSION));
            var stage = new ArchiveStage(target.name(), collect.outputDir(), archiveFile, context.archiveWriter());
            stage.dependsOn(collect.name());
            return stage;
        });
    }

    ArtifactHandle createArtifact(Target target, ArchiveStage archive) {
        return context.artifactCache().getOrCreate(target.name(),
            () -> new ArtifactHandle(target.name(), archive.archiveFile(), target.name(), archive.name()));
    }

    void configurePublishing(Target target, ArtifactHandle artifact, ArchiveStage archive) {
        context.artifactCache().registerPublicationOnce(target.name(), artifact, () -> {
            var coordinates = context.coordinates();
            var publication = new Publication(
                coordinates.group(), coordinates.artifactId(), coordinates.version(), artifact, target.name());
            createStage(StageKind.PUBLISH.stageName(target.name()), PublishStage.class, () -> {
                var stage = new PublishStage(target.name(), publication, context.publicationSink());
                stage.dependsOn(archive.name());
                return stage;
            });
            context.addPublication(publication);
        });
    }

    AggregateStage aggregate() {
        return context.stages().getOrCreate(AggregateStage.NAME, AggregateStage.class, AggregateStage::new);
    }

    private <S extends Stage> S createStage(String name, Class<S> type, Supplier<S> factory) {
        try {
            return context.stages().getOrCreate(name, type, () -> {
                S stage = factory.get();
                log.info("Created stage {}", name);
                return stage;
            });
        } catch (StagingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PipelineStageException(name, ex);
        }
    }
}

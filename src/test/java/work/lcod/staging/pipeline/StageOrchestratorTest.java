package work.lcod.staging.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.staging.support.StagingTestSupport;
import work.lcod.staging.target.Target;

class StageOrchestratorTest {
    @TempDir
    Path projectDir;

    @Test
    void createsPipelinePerTarget() {
        var context = StagingTestSupport.context(projectDir).build();

        new StageOrchestrator(context).configure(targets(Target.of("dev", Map.of("a", "1")), Target.withoutContext("prod")));

        assertEquals(
            List.of("devRender", "devResources", "devArchive", "devPublish", "stage",
                "prodResources", "prodArchive", "prodPublish"),
            names(context));
        var archive = (ArchiveStage) context.stages().require("devArchive");
        assertEquals(context.layout().libsDir().resolve("app-1.0.0-dev.zip"), archive.archiveFile());
        assertEquals(List.of("devResources"), archive.dependencies());
        assertEquals(List.of("devRender"), context.stages().require("devResources").dependencies());
        assertEquals(List.of(), context.stages().require("prodResources").dependencies());
        assertEquals(List.of("devPublish", "prodPublish"), context.stages().require("stage").dependencies());
    }

    @Test
    void reconfigurationDoesNotDuplicateStagesOrPublications() {
        var context = StagingTestSupport.context(projectDir).build();
        var orchestrator = new StageOrchestrator(context);
        var targets = targets(Target.of("dev", Map.of("a", "1")), Target.of("prod", Map.of("a", "2")));

        orchestrator.configure(targets);
        var stagesAfterFirst = context.stages().asMap();
        var artifactsAfterFirst = context.artifactCache().artifacts();
        orchestrator.configure(targets);
        orchestrator.configure(targets);

        assertEquals(stagesAfterFirst.keySet(), context.stages().asMap().keySet());
        stagesAfterFirst.forEach((name, stage) -> assertSame(stage, context.stages().require(name)));
        assertEquals(artifactsAfterFirst, context.artifactCache().artifacts());
        assertEquals(2, context.publications().size());
        assertEquals(List.of("dev", "prod"),
            context.publications().stream().map(p -> p.classifier()).collect(Collectors.toList()));
    }

    @Test
    void renderStageIsCreatedOnceAndMergesGlobalContext() {
        var context = StagingTestSupport.context(projectDir)
            .contextValues(Map.of("region", "eu", "a", "global"))
            .build();
        var orchestrator = new StageOrchestrator(context);

        orchestrator.configureTarget(Target.of("dev", Map.of("a", "1")));
        var render = (RenderStage) context.stages().require("devRender");
        orchestrator.configureTarget(Target.of("dev", Map.of("a", "changed")));

        assertSame(render, context.stages().require("devRender"));
        assertEquals(Map.of("a", "1", "region", "eu"), render.context());
        assertEquals(context.layout().generatedPropertiesDir(), render.inputDir());
        assertEquals(context.layout().renderDir("dev"), render.outputDir());
    }

    @Test
    void rejectsTargetWithoutName() {
        var context = StagingTestSupport.context(projectDir).build();
        var orchestrator = new StageOrchestrator(context);

        var thrown = assertThrows(InvalidTargetException.class,
            () -> orchestrator.configureTarget(Target.of(" ", Map.of())));
        assertEquals("invalid_target", thrown.code());
        assertThrows(InvalidTargetException.class,
            () -> orchestrator.configureTarget(Target.fromMap(Map.of("context", Map.of("a", "1")))));
    }

    @Test
    void failingTargetDoesNotStopOrRollBackOthers() {
        var context = StagingTestSupport.context(projectDir).build();
        var targets = new LinkedHashMap<String, Target>();
        targets.put("dev", Target.of("dev", Map.of()));
        targets.put("broken", Target.withoutContext(null));
        targets.put("other", Target.withoutContext(""));
        targets.put("prod", Target.of("prod", Map.of()));

        var thrown = assertThrows(InvalidTargetException.class, () -> new StageOrchestrator(context).configure(targets));

        assertEquals(1, thrown.getSuppressed().length);
        assertInstanceOf(InvalidTargetException.class, thrown.getSuppressed()[0]);
        assertTrue(context.stages().contains("devArchive"));
        assertTrue(context.stages().contains("prodArchive"));
        assertEquals(2, context.publications().size());
    }

    @Test
    void stageNameClashWithDifferentTypeIsAStageFailure() {
        var context = StagingTestSupport.context(projectDir).build();
        context.stages().getOrCreate("devResources", AggregateStage.class, AggregateStage::new);

        var thrown = assertThrows(PipelineStageException.class,
            () -> new StageOrchestrator(context).configureTarget(Target.withoutContext("dev")));

        assertEquals("devResources", thrown.stageName());
        assertFalse(context.stages().contains("devArchive"));
    }

    private static Map<String, Target> targets(Target... targets) {
        var map = new LinkedHashMap<String, Target>();
        for (Target target : targets) {
            map.put(target.name(), target);
        }
        return map;
    }

    private static List<String> names(StagingContext context) {
        return context.stages().stages().stream().map(Stage::name).collect(Collectors.toList());
    }
}

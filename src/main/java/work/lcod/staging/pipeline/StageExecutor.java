package work.lcod.staging.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs registered stages after their dependencies, each stage at most once per executor.
 */
public final class StageExecutor {
    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final StageRegistry registry;
    private final Set<String> executed = new LinkedHashSet<>();

    public StageExecutor(StageRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Runs {@code stageName} and everything it depends on.
     *
     * @return the stages run by this call, in execution order
     * @throws PipelineStageException when a stage fails or the dependencies form a cycle
     */
    public List<String> execute(String stageName) {
        var ran = new ArrayList<String>();
        execute(stageName, new HashSet<>(), ran);
        return ran;
    }

    public Set<String> executed() {
        return Set.copyOf(executed);
    }

    private void execute(String stageName, Set<String> visiting, List<String> ran) {
        if (executed.contains(stageName)) {
            return;
        }
        if (!visiting.add(stageName)) {
            throw new PipelineStageException(stageName, new IllegalStateException("Dependency cycle through " + visiting));
        }
        Stage stage = registry.find(stageName)
            .orElseThrow(() -> new PipelineStageException(stageName, new IllegalStateException("Stage not registered")));
        for (String dependency : stage.dependencies()) {
            execute(dependency, visiting, ran);
        }
        log.debug("Executing stage {}", stageName);
        try {
            stage.execute();
        } catch (PipelineStageException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new PipelineStageException(stageName, ex);
        }
        visiting.remove(stageName);
        executed.add(stageName);
        ran.add(stageName);
    }
}

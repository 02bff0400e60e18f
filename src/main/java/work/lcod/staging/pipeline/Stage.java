package work.lcod.staging.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A named unit of work in the staging pipeline.
 */
public interface Stage {
    String name();

    StageKind kind();

    /** Target the stage belongs to; empty for the aggregate stage. */
    Optional<String> targetName();

    /** Names of the stages that must run first. */
    List<String> dependencies();

    /** Directory or file the stage produces, when it produces one. */
    Optional<Path> output();

    void execute() throws IOException;
}

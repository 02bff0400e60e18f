package work.lcod.staging.pipeline;

import work.lcod.staging.shared.StagingException;
import work.lcod.staging.target.Target;

/**
 * A target handed to the orchestrator has no name.
 */
public final class InvalidTargetException extends StagingException {
    public InvalidTargetException(Target target) {
        super("invalid_target", "Missing target name: " + target);
    }
}

package work.lcod.staging.pipeline;

import work.lcod.staging.shared.StagingException;

/**
 * Building or running a stage failed.
 */
public final class PipelineStageException extends StagingException {
    private final String stageName;

    public PipelineStageException(String stageName, Throwable cause) {
        super("pipeline_stage", "Stage " + stageName + " failed: " + describe(cause), cause);
        this.stageName = stageName;
    }

    public String stageName() {
        return stageName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}

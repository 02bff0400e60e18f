package work.lcod.staging.pipeline;

/**
 * The steps of a target pipeline, in execution order, plus the aggregate over all targets.
 */
public enum StageKind {
    RENDER("Render"),
    COLLECT("Resources"),
    ARCHIVE("Archive"),
    PUBLISH("Publish"),
    AGGREGATE("");

    private final String suffix;

    StageKind(String suffix) {
        this.suffix = suffix;
    }

    /** Stage name for a target, e.g. {@code devArchive}. */
    public String stageName(String targetName) {
        return targetName + suffix;
    }
}

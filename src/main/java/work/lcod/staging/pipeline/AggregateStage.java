package work.lcod.staging.pipeline;

/**
 * Depends on every configured target; running it stages all targets.
 */
public final class AggregateStage extends AbstractStage {
    public static final String NAME = "stage";

    AggregateStage() {
        super(NAME, StageKind.AGGREGATE, null);
    }

    @Override
    public void execute() {
        // Work happens in the dependencies.
    }
}

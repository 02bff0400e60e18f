package work.lcod.staging.cli;

/**
 * {@code lcod-stage} launcher; the exit code is the run status.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(StageCommand.newCommandLine().execute(args));
    }
}

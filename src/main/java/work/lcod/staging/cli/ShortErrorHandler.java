package work.lcod.staging.cli;

import picocli.CommandLine;
import work.lcod.staging.api.RunResult;
import work.lcod.staging.shared.StagingException;

/**
 * Reports failures raised before a run starts, such as an unreadable manifest, as one line.
 *
 * <p>Staging failures are prefixed with their code and exit like a failed run; anything else is
 * an unexpected error and keeps picocli's execution-failure exit code.</p>
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(describe(ex)));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof StagingException) {
            return RunResult.Status.FAILURE.exitCode();
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        if (ex instanceof StagingException staging) {
            return staging.code() + ": " + message;
        }
        return message;
    }
}

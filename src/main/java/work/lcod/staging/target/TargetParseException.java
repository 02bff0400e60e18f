package work.lcod.staging.target;

import java.nio.file.Path;
import work.lcod.staging.shared.StagingException;

/**
 * A target definition file could not be opened or loaded.
 */
public final class TargetParseException extends StagingException {
    private final Path file;

    public TargetParseException(Path file, Throwable cause) {
        super("target_parse", "Unable to parse target properties file: " + file.toAbsolutePath(), cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}

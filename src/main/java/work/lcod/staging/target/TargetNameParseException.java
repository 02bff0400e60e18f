package work.lcod.staging.target;

import java.nio.file.Path;
import work.lcod.staging.shared.StagingException;

/**
 * A file was selected by a template but no target name could be read from its first capture group.
 */
public final class TargetNameParseException extends StagingException {
    private final String fileName;
    private final String patternSource;

    public TargetNameParseException(Path file, String patternSource) {
        super("target_name_parse",
            "Unable to parse target name " + file.getFileName() + " using pattern " + patternSource + ": " + file);
        this.fileName = String.valueOf(file.getFileName());
        this.patternSource = patternSource;
    }

    public String fileName() {
        return fileName;
    }

    public String patternSource() {
        return patternSource;
    }
}

package work.lcod.staging.artifact;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Packs the content of a directory into a single archive file.
 */
@FunctionalInterface
public interface ArchiveWriter {
    void write(Path sourceDir, Path archiveFile) throws IOException;
}

package work.lcod.staging.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.artifact.ArchiveWriter;

/**
 * Packs a target's collected resources into its archive.
 */
public final class ArchiveStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(ArchiveStage.class);

    private final Path sourceDir;
    private final Path archiveFile;
    private final ArchiveWriter writer;

    ArchiveStage(String targetName, Path sourceDir, Path archiveFile, ArchiveWriter writer) {
        super(StageKind.ARCHIVE.stageName(targetName), StageKind.ARCHIVE, targetName);
        this.sourceDir = sourceDir;
        this.archiveFile = archiveFile;
        this.writer = writer;
    }

    public Path sourceDir() {
        return sourceDir;
    }

    public Path archiveFile() {
        return archiveFile;
    }

    @Override
    public Optional<Path> output() {
        return Optional.of(archiveFile);
    }

    @Override
    public void execute() throws IOException {
        writer.write(sourceDir, archiveFile);
        log.info("Archived {} into {}", sourceDir, archiveFile);
    }
}

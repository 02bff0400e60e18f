package work.lcod.staging.artifact;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.shared.FileTrees;

/**
 * Copies published artifacts into a Maven-style directory layout:
 * {@code <root>/<group path>/<artifactId>/<version>/<artifactId>-<version>-<classifier>.<ext>}.
 */
public final class LocalRepositoryPublicationSink implements PublicationSink {
    private static final Logger log = LoggerFactory.getLogger(LocalRepositoryPublicationSink.class);

    private final Path root;

    public LocalRepositoryPublicationSink(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public void publish(Publication publication) throws IOException {
        Path source = publication.artifact().file();
        if (!Files.isRegularFile(source)) {
            throw new IOException("Artifact has not been built: " + source);
        }
        Path target = resolve(publication);
        FileTrees.copyFile(source, target);
        log.info("Published {} to {}", source.getFileName(), target);
    }

    public Path resolve(Publication publication) {
        Path dir = root;
        if (publication.groupId() != null && !publication.groupId().isBlank()) {
            for (String segment : publication.groupId().split("\\.")) {
                dir = dir.resolve(segment);
            }
        }
        return dir.resolve(publication.artifactId())
            .resolve(publication.version())
            .resolve(publication.fileName());
    }
}

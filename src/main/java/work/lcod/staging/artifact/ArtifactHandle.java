package work.lcod.staging.artifact;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An archive registered for a target, together with the stage that builds it.
 */
public record ArtifactHandle(String targetName, Path file, String classifier, String builtBy) {
    public ArtifactHandle {
        Objects.requireNonNull(targetName, "targetName");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(classifier, "classifier");
    }

    public String extension() {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }
}

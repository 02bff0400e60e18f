package work.lcod.staging.artifact;

import java.util.Objects;

/**
 * A request to publish one artifact under the project coordinates with a classifier.
 */
public record Publication(String groupId, String artifactId, String version, ArtifactHandle artifact, String classifier) {
    public Publication {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(classifier, "classifier");
    }

    public String fileName() {
        return artifactId + "-" + version + "-" + classifier + "." + artifact.extension();
    }
}

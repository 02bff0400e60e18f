package work.lcod.staging.pipeline;

import java.util.Objects;

/**
 * Coordinates the archives are named and published under.
 */
public record ProjectCoordinates(String group, String artifactId, String version) {
    public ProjectCoordinates {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(version, "version");
        if (artifactId.isBlank()) {
            throw new IllegalArgumentException("artifactId must not be blank");
        }
    }

    /** {@code <artifactId>-<version>-<targetName>.<extension>} */
    public String archiveFileName(String targetName, String extension) {
        return artifactId + "-" + version + "-" + targetName + "." + extension;
    }
}

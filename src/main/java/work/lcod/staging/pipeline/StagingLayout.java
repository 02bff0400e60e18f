package work.lcod.staging.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Source and build directories of a staging project.
 */
public record StagingLayout(
    Path projectDir,
    Path buildDir,
    Path targetsDir,
    Path defaultsDir,
    Path templatesDir,
    Path resourcesDir,
    Path repositoryDir
) {
    public StagingLayout {
        Objects.requireNonNull(projectDir, "projectDir");
        Objects.requireNonNull(buildDir, "buildDir");
        Objects.requireNonNull(targetsDir, "targetsDir");
        Objects.requireNonNull(defaultsDir, "defaultsDir");
        Objects.requireNonNull(templatesDir, "templatesDir");
        Objects.requireNonNull(resourcesDir, "resourcesDir");
        Objects.requireNonNull(repositoryDir, "repositoryDir");
    }

    /** Conventional layout below {@code projectDir}. */
    public static StagingLayout conventional(Path projectDir) {
        Path project = projectDir.toAbsolutePath().normalize();
        Path build = project.resolve("build");
        return new StagingLayout(
            project,
            build,
            project.resolve("src/main/targets"),
            project.resolve("src/main/defaults"),
            project.resolve("src/main/templates"),
            project.resolve("src/main/resources"),
            build.resolve("repository")
        );
    }

    public StagingLayout withTargetsDir(Path dir) {
        return new StagingLayout(projectDir, buildDir, dir, defaultsDir, templatesDir, resourcesDir, repositoryDir);
    }

    /** Where merged property files are generated; the shared input of every render stage. */
    public Path generatedPropertiesDir() {
        return buildDir.resolve("vtl");
    }

    public Path renderDir(String targetName) {
        return buildDir.resolve("templates").resolve(targetName);
    }

    public Path collectDir(String targetName) {
        return buildDir.resolve("resources").resolve(targetName);
    }

    public Path libsDir() {
        return buildDir.resolve("libs");
    }
}

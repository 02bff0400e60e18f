package work.lcod.staging.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lcod.staging.artifact.Publication;
import work.lcod.staging.shared.StagingException;

/**
 * Outcome of a staging run: what was discovered, generated, configured and executed before the
 * run finished or stopped.
 *
 * <p>Fields describe progress up to the failure point; a run that failed while generating
 * properties still reports the targets it discovered.</p>
 *
 * @param errorCode {@link StagingException#code()} of the failure, when the failure carries one
 */
public record RunResult(
    Status status,
    Path projectDir,
    List<String> targets,
    List<Path> generated,
    List<String> stages,
    List<Path> archives,
    List<Publication> publications,
    List<String> executed,
    Optional<String> errorCode,
    Optional<String> error,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(projectDir, "projectDir");
        Objects.requireNonNull(errorCode, "errorCode");
        Objects.requireNonNull(error, "error");
        targets = List.copyOf(targets);
        generated = List.copyOf(generated);
        stages = List.copyOf(stages);
        archives = List.copyOf(archives);
        publications = List.copyOf(publications);
        executed = List.copyOf(executed);
    }

    static Builder builder(Path projectDir) {
        return new Builder(projectDir, Instant.now());
    }

    public int exitCode() {
        return status.exitCode();
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.label());
        errorCode.ifPresent(code -> serializable.put("code", code));
        error.ifPresent(message -> serializable.put("error", message));
        serializable.put("project", projectDir.toString());
        serializable.put("targets", targets);
        serializable.put("generated", strings(generated));
        serializable.put("stages", stages);
        serializable.put("archives", strings(archives));
        serializable.put("publications", publications.stream().map(RunResult::describe).collect(Collectors.toList()));
        if (status != Status.PLANNED) {
            serializable.put("executed", executed);
        }
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            return "{\"status\":\"error\",\"error\":\"" + ex.getOriginalMessage() + "\"}";
        }
    }

    private static List<String> strings(List<Path> paths) {
        return paths.stream().map(Path::toString).collect(Collectors.toList());
    }

    private static Map<String, Object> describe(Publication publication) {
        var map = new LinkedHashMap<String, Object>();
        map.put("groupId", publication.groupId());
        map.put("artifactId", publication.artifactId());
        map.put("version", publication.version());
        map.put("classifier", publication.classifier());
        map.put("file", publication.artifact().file().toString());
        return map;
    }

    public enum Status {
        SUCCESS("ok", 0),
        FAILURE("error", 1),
        PLANNED("planned", 0);

        private final String label;
        private final int exitCode;

        Status(String label, int exitCode) {
            this.label = label;
            this.exitCode = exitCode;
        }

        public String label() {
            return label;
        }

        public int exitCode() {
            return exitCode;
        }
    }

    /** Collects the progress of a run as it happens. */
    static final class Builder {
        private final Path projectDir;
        private final Instant startedAt;
        private List<String> targets = List.of();
        private List<Path> generated = List.of();
        private List<String> stages = List.of();
        private List<Path> archives = List.of();
        private List<Publication> publications = List.of();
        private List<String> executed = List.of();

        private Builder(Path projectDir, Instant startedAt) {
            this.projectDir = projectDir;
            this.startedAt = startedAt;
        }

        Builder targets(Collection<String> targets) {
            this.targets = new ArrayList<>(targets);
            return this;
        }

        Builder generated(List<Path> generated) {
            this.generated = generated;
            return this;
        }

        Builder stages(List<String> stages) {
            this.stages = stages;
            return this;
        }

        Builder archives(List<Path> archives) {
            this.archives = archives;
            return this;
        }

        Builder publications(List<Publication> publications) {
            this.publications = publications;
            return this;
        }

        Builder executed(List<String> executed) {
            this.executed = executed;
            return this;
        }

        RunResult success() {
            return build(Status.SUCCESS, Optional.empty(), Optional.empty());
        }

        RunResult planned() {
            return build(Status.PLANNED, Optional.empty(), Optional.empty());
        }

        RunResult failure(Exception ex) {
            String message = ex.getMessage() != null && !ex.getMessage().isBlank()
                ? ex.getMessage()
                : ex.getClass().getSimpleName();
            Optional<String> code = ex instanceof StagingException staging
                ? Optional.of(staging.code())
                : Optional.empty();
            return build(Status.FAILURE, code, Optional.of(message));
        }

        private RunResult build(Status status, Optional<String> errorCode, Optional<String> error) {
            return new RunResult(status, projectDir, targets, generated, stages, archives, publications, executed,
                errorCode, error, startedAt, Instant.now());
        }
    }
}

package work.lcod.staging.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

abstract class AbstractStage implements Stage {
    private final String name;
    private final StageKind kind;
    private final String targetName;
    private final List<String> dependencies = new ArrayList<>();

    AbstractStage(String name, StageKind kind, String targetName) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.targetName = targetName;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StageKind kind() {
        return kind;
    }

    @Override
    public Optional<String> targetName() {
        return Optional.ofNullable(targetName);
    }

    @Override
    public synchronized List<String> dependencies() {
        return List.copyOf(dependencies);
    }

    @Override
    public Optional<Path> output() {
        return Optional.empty();
    }

    synchronized void dependsOn(String stageName) {
        if (!dependencies.contains(stageName)) {
            dependencies.add(stageName);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}

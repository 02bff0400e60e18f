package work.lcod.staging.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.shared.FileTrees;

/**
 * Copies the resources of one target into its resources directory.
 *
 * <p>Unless every resource is included, only files named {@code <name>.<target>} are selected and
 * they are written as {@code <name>}. Rendered templates of the target, when present, are copied
 * afterwards without filtering.</p>
 */
public final class CollectStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(CollectStage.class);

    private final Path resourcesDir;
    private final Path renderedDir;
    private final Path outputDir;
    private final boolean includeAllResources;

    CollectStage(String targetName, Path resourcesDir, Path renderedDir, Path outputDir, boolean includeAllResources) {
        super(StageKind.COLLECT.stageName(targetName), StageKind.COLLECT, targetName);
        this.resourcesDir = resourcesDir;
        this.renderedDir = renderedDir;
        this.outputDir = outputDir;
        this.includeAllResources = includeAllResources;
    }

    public Path outputDir() {
        return outputDir;
    }

    public boolean includeAllResources() {
        return includeAllResources;
    }

    @Override
    public Optional<Path> output() {
        return Optional.of(outputDir);
    }

    @Override
    public void execute() throws IOException {
        FileTrees.deleteTree(outputDir);
        Files.createDirectories(outputDir);
        String target = targetName().orElseThrow();
        int count = 0;
        for (Path resource : FileTrees.listFiles(resourcesDir, path -> isSelected(path.getFileName().toString(), target))) {
            Path relative = resourcesDir.relativize(resource);
            String name = rename(relative.getFileName().toString(), target);
            Path parent = relative.getParent();
            Path destination = parent == null
                ? outputDir.resolve(name)
                : outputDir.resolve(parent.toString()).resolve(name);
            FileTrees.copyFile(resource, destination);
            count++;
        }
        if (renderedDir != null) {
            count += FileTrees.copyTree(renderedDir, outputDir).size();
        }
        log.info("Collected {} resource(s) for {} into {}", count, target, outputDir);
    }

    boolean isSelected(String fileName, String target) {
        return includeAllResources || fileName.endsWith("." + target);
    }

    String rename(String fileName, String target) {
        if (includeAllResources) {
            return fileName;
        }
        String stripped = fileName.substring(0, fileName.length() - target.length() - 1);
        return stripped.isEmpty() ? fileName : stripped;
    }
}

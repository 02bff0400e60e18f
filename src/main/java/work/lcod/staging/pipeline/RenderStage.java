package work.lcod.staging.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.render.TemplateRenderer;
import work.lcod.staging.shared.FileTrees;

/**
 * Renders every file of the shared templates output against one target's context.
 */
public final class RenderStage extends AbstractStage {
    private static final Logger log = LoggerFactory.getLogger(RenderStage.class);

    private final Path inputDir;
    private final Path outputDir;
    private final Map<String, String> context;
    private final TemplateRenderer renderer;

    RenderStage(String targetName, Path inputDir, Path outputDir, Map<String, String> context, TemplateRenderer renderer) {
        super(StageKind.RENDER.stageName(targetName), StageKind.RENDER, targetName);
        this.inputDir = inputDir;
        this.outputDir = outputDir;
        this.context = Collections.unmodifiableMap(new TreeMap<>(context));
        this.renderer = renderer;
    }

    public Path inputDir() {
        return inputDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Map<String, String> context() {
        return context;
    }

    @Override
    public Optional<Path> output() {
        return Optional.of(outputDir);
    }

    @Override
    public void execute() throws IOException {
        FileTrees.deleteTree(outputDir);
        Files.createDirectories(outputDir);
        int count = 0;
        for (Path template : FileTrees.listFiles(inputDir)) {
            Path target = outputDir.resolve(inputDir.relativize(template).toString());
            String rendered = renderer.render(template, context);
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, rendered, renderer.charset());
            count++;
        }
        log.info("Rendered {} template(s) for {} into {}", count, targetName().orElse(""), outputDir);
    }
}

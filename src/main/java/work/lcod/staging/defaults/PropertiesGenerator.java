package work.lcod.staging.defaults;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.shared.FileTrees;

/**
 * Generates property files by merging defaults with the property templates they apply to.
 *
 * <p>Each defaults file {@code <dir>/<basename>.defaults.vtl} applies to the files in
 * {@code <templatesRoot>/<dir>} whose names start with {@code basename}. The merged result is
 * written under {@code <outputRoot>/<dir>} with the template's file name. When no defaults exist
 * the templates are copied unchanged.</p>
 */
public final class PropertiesGenerator {
    /** Encoding of property files. Decoding never fails, so any byte sequence is carried through unchanged. */
    public static final Charset PROPERTIES_CHARSET = StandardCharsets.ISO_8859_1;

    private static final Logger log = LoggerFactory.getLogger(PropertiesGenerator.class);

    private final Path defaultsRoot;
    private final Path templatesRoot;
    private final Path outputRoot;
    private final MergeOptions options;

    public PropertiesGenerator(Path defaultsRoot, Path templatesRoot, Path outputRoot, MergeOptions options) {
        this.defaultsRoot = defaultsRoot;
        this.templatesRoot = Objects.requireNonNull(templatesRoot, "templatesRoot");
        this.outputRoot = Objects.requireNonNull(outputRoot, "outputRoot");
        this.options = Objects.requireNonNull(options, "options");
    }

    public static List<Path> mergeDefaults(
        Path defaultsRoot,
        Path templatesRoot,
        Path outputRoot,
        MergeOptions options
    ) throws IOException {
        return new PropertiesGenerator(defaultsRoot, templatesRoot, outputRoot, options).generate();
    }

    /**
     * Runs the merge and returns every file written.
     *
     * @throws StructuralInconsistencyException in structured mode, when the files of a batch disagree on their keys
     */
    public List<Path> generate() throws IOException {
        if (!Files.isDirectory(templatesRoot)) {
            log.warn("Skipping property generation, templates directory not found: {}", templatesRoot);
            return List.of();
        }
        Files.createDirectories(outputRoot);
        List<DefaultsEntry> defaults = DefaultsReader.read(defaultsRoot, options.defaultsFileExtension());
        if (defaults.isEmpty()) {
            return copyTemplates();
        }
        var generated = new ArrayList<Path>();
        for (DefaultsEntry entry : defaults) {
            generated.addAll(generate(entry));
        }
        return generated;
    }

    List<Path> generate(DefaultsEntry entry) throws IOException {
        Path resolvedInputDir = parentOf(templatesRoot.resolve(entry.relativePath().toString()));
        Path resolvedOutputDir = parentOf(outputRoot.resolve(entry.relativePath().toString()));
        List<Path> candidates = findCandidates(resolvedInputDir, entry.basename());
        if (candidates.isEmpty()) {
            log.warn("No property templates starting with {} in {}", entry.basename(), resolvedInputDir);
        }
        var generated = new ArrayList<Path>(candidates.size());
        for (Path candidate : candidates) {
            generated.add(generate(entry.lines(), candidate, resolvedOutputDir));
        }
        if (options.structured()) {
            PropertySets.requireSameKeys(PropertySets.readAll(generated));
        }
        return generated;
    }

    private Path generate(List<String> defaults, Path template, Path resolvedOutputDir) throws IOException {
        Path propertiesFile = resolvedOutputDir.resolve(template.getFileName().toString());
        List<String> own = Files.readAllLines(template, PROPERTIES_CHARSET);
        Files.createDirectories(resolvedOutputDir);
        Files.writeString(propertiesFile, String.join(System.lineSeparator(), merge(defaults, own, options)),
            PROPERTIES_CHARSET);
        log.info("Generated {}", propertiesFile.toAbsolutePath());
        return propertiesFile;
    }

    /**
     * Concatenates defaults and own lines in the configured order, then applies trim and sort.
     * Sorting covers the whole sequence, so defaults and own lines may interleave. Duplicate keys
     * are kept; the consumer decides which value wins.
     */
    public static List<String> merge(List<String> defaults, List<String> own, MergeOptions options) {
        List<String> prefix = options.prepend() ? own : defaults;
        List<String> suffix = options.prepend() ? defaults : own;
        var builder = new ArrayList<String>(prefix.size() + suffix.size());
        builder.addAll(prefix);
        builder.addAll(suffix);
        Stream<String> lines = builder.stream();
        if (options.trim()) {
            lines = lines.filter(line -> !line.trim().isEmpty());
        }
        if (options.sort()) {
            lines = lines.sorted();
        }
        return lines.collect(Collectors.toList());
    }

    private List<Path> copyTemplates() throws IOException {
        List<Path> copied = FileTrees.copyTree(templatesRoot, outputRoot);
        log.info("No defaults found, copied {} template(s) into {}", copied.size(), outputRoot);
        if (options.structured()) {
            PropertySets.requireSameKeys(PropertySets.readAll(copied));
        }
        return copied;
    }

    private static List<Path> findCandidates(Path dir, String basename) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (var stream = Files.list(dir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(path -> path.getFileName().toString().startsWith(basename))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static Path parentOf(Path path) {
        Path parent = path.getParent();
        return parent != null ? parent : path;
    }
}

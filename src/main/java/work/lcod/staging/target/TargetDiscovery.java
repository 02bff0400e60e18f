package work.lcod.staging.target;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.staging.shared.InvalidConfigurationException;

/**
 * Parses a flat directory of target definition files into named targets.
 *
 * <p>Templates are applied in the order given. When two templates yield the same target name the
 * later template wins.</p>
 */
public final class TargetDiscovery {
    private static final Logger log = LoggerFactory.getLogger(TargetDiscovery.class);

    private TargetDiscovery() {}

    public static Map<String, Target> discover(Path targetsDir) {
        return discover(targetsDir, List.of());
    }

    public static Map<String, Target> discover(Path targetsDir, List<Template> templates) {
        if (targetsDir == null || !Files.isDirectory(targetsDir)) {
            throw new InvalidConfigurationException("Targets directory not found: " + targetsDir);
        }
        var result = new LinkedHashMap<String, Target>();
        for (Template template : Templates.orDefaults(templates)) {
            result.putAll(discover(targetsDir, template));
        }
        log.info("Discovered {} target(s) in {}: {}", result.size(), targetsDir, result.keySet());
        return result;
    }

    public static Map<String, Target> discover(Path targetsDir, Template template) {
        var result = new LinkedHashMap<String, Target>();
        for (Path file : listMatching(targetsDir, template)) {
            Target target = parseFile(file, template);
            Target previous = result.put(target.name(), target);
            if (previous != null) {
                log.debug("Target {} redefined by {}", target.name(), file);
            }
        }
        return result;
    }

    static Target parseFile(Path file, Template template) {
        String name = parseTargetName(file, template);
        try (var stream = Files.newInputStream(file)) {
            var context = template.load(stream);
            log.debug("Loaded target {} from {}", name, file);
            return Target.of(name, context);
        } catch (IOException | RuntimeException ex) {
            throw new TargetParseException(file, ex);
        }
    }

    static String parseTargetName(Path file, Template template) {
        String fileName = file.getFileName().toString();
        return template.extractName(fileName)
            .filter(name -> !name.isEmpty())
            .orElseThrow(() -> new TargetNameParseException(file, template.patternSource()));
    }

    private static List<Path> listMatching(Path targetsDir, Template template) {
        try (var stream = Files.list(targetsDir)) {
            return stream
                .filter(Files::isRegularFile)
                .filter(path -> template.matches(path.getFileName().toString()))
                .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new InvalidConfigurationException("Unable to list targets directory: " + targetsDir, ex);
        }
    }
}

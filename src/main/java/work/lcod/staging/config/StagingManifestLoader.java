package work.lcod.staging.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.staging.api.LogLevel;
import work.lcod.staging.api.StagingConfiguration;
import work.lcod.staging.defaults.MergeOptions;
import work.lcod.staging.pipeline.StagingLayout;
import work.lcod.staging.shared.InvalidConfigurationException;
import work.lcod.staging.target.Loaders;
import work.lcod.staging.target.Target;
import work.lcod.staging.target.Template;

/**
 * Reads {@code staging.toml} manifests into a configuration builder.
 *
 * <pre>
 * [project]     group, artifactId, version
 * [layout]      buildDir, targetsDir, defaultsDir, templatesDir, resourcesDir, repositoryDir
 * [properties]  sort, trim, structured, prepend, defaultsFileExtension
 * [staging]     includeAllResources, strict, logLevel
 * [context]     global context values
 * [[templates]] mask or pattern, format (properties|xml|json|yaml)
 * [targets.NAME] context values of a declared target
 * </pre>
 *
 * Layout paths are resolved against the project directory.
 */
public final class StagingManifestLoader {
    public static final String MANIFEST_FILE = "staging.toml";

    private static final Logger log = LoggerFactory.getLogger(StagingManifestLoader.class);

    private StagingManifestLoader() {}

    /** Loads {@code <projectDir>/staging.toml}, or returns the conventions when it does not exist. */
    public static StagingConfiguration.Builder load(Path projectDir) {
        return load(projectDir, projectDir.resolve(MANIFEST_FILE));
    }

    public static StagingConfiguration.Builder load(Path projectDir, Path manifestPath) {
        Path project = projectDir.toAbsolutePath().normalize();
        var builder = StagingConfiguration.builder().projectDir(project);
        if (manifestPath == null || !Files.isRegularFile(manifestPath)) {
            log.debug("No staging manifest at {}, using conventions", manifestPath);
            return builder;
        }
        TomlParseResult manifest = parseToml(manifestPath);
        try {
            apply(project, manifest, builder);
        } catch (TomlInvalidTypeException | IllegalArgumentException ex) {
            throw new InvalidConfigurationException("Invalid value in " + manifestPath + ": " + ex.getMessage(), ex);
        }
        log.info("Loaded staging manifest {}", manifestPath);
        return builder;
    }

    static TomlParseResult parseToml(Path path) {
        try {
            TomlParseResult result = Toml.parse(Files.readString(path));
            if (result.hasErrors()) {
                String errors = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
                throw new InvalidConfigurationException("Unable to parse " + path + ": " + errors);
            }
            return result;
        } catch (IOException ex) {
            throw new InvalidConfigurationException("Unable to read " + path, ex);
        }
    }

    static void apply(Path project, TomlParseResult manifest, StagingConfiguration.Builder builder) {
        TomlTable projectSection = manifest.getTable("project");
        if (projectSection != null) {
            Optional.ofNullable(projectSection.getString("group")).ifPresent(builder::group);
            Optional.ofNullable(projectSection.getString("artifactId")).ifPresent(builder::artifactId);
            Optional.ofNullable(projectSection.getString("version")).ifPresent(builder::version);
        }
        builder.layout(readLayout(project, manifest.getTable("layout")));
        builder.mergeOptions(readMergeOptions(manifest.getTable("properties")));

        TomlTable staging = manifest.getTable("staging");
        if (staging != null) {
            builder.includeAllResources(flag(staging, "includeAllResources", false));
            builder.strictRendering(flag(staging, "strict", false));
            Optional.ofNullable(staging.getString("logLevel")).map(LogLevel::from).ifPresent(builder::logLevel);
        }
        builder.contextValues(readValues(manifest.getTable("context")));

        TomlArray templates = manifest.getArray("templates");
        if (templates != null) {
            for (int i = 0; i < templates.size(); i++) {
                builder.template(readTemplate(templates.getTable(i)));
            }
        }
        TomlTable targets = manifest.getTable("targets");
        if (targets != null) {
            for (String name : targets.keySet()) {
                TomlTable values = targets.getTable(List.of(name));
                builder.target(Target.of(name, readValues(values)));
            }
        }
    }

    static StagingLayout readLayout(Path project, TomlTable table) {
        StagingLayout conventional = StagingLayout.conventional(project);
        if (table == null) {
            return conventional;
        }
        Path buildDir = path(project, table, "buildDir", conventional.buildDir());
        return new StagingLayout(
            project,
            buildDir,
            path(project, table, "targetsDir", conventional.targetsDir()),
            path(project, table, "defaultsDir", conventional.defaultsDir()),
            path(project, table, "templatesDir", conventional.templatesDir()),
            path(project, table, "resourcesDir", conventional.resourcesDir()),
            path(project, table, "repositoryDir", buildDir.resolve("repository"))
        );
    }

    static MergeOptions readMergeOptions(TomlTable table) {
        var options = MergeOptions.builder();
        if (table == null) {
            return options.build();
        }
        return options
            .sort(flag(table, "sort", false))
            .trim(flag(table, "trim", false))
            .structured(flag(table, "structured", false))
            .prepend(flag(table, "prepend", false))
            .defaultsFileExtension(Optional.ofNullable(table.getString("defaultsFileExtension"))
                .orElse(MergeOptions.DEFAULT_DEFAULTS_FILE_EXTENSION))
            .build();
    }

    static Template readTemplate(TomlTable table) {
        if (table == null) {
            throw new InvalidConfigurationException("Template entries must be tables");
        }
        var values = new LinkedHashMap<String, Object>();
        Optional.ofNullable(table.getString("pattern")).ifPresent(pattern -> values.put("pattern", pattern));
        Optional.ofNullable(table.getString("mask")).ifPresent(mask -> values.put("mask", mask));
        values.put("load", Loaders.forFormat(table.getString("format")));
        return Template.fromMap(values);
    }

    static Map<String, String> readValues(TomlTable table) {
        var values = new LinkedHashMap<String, String>();
        if (table != null) {
            flatten("", table.toMap(), values);
        }
        return values;
    }

    private static void flatten(String prefix, Map<String, Object> source, Map<String, String> out) {
        for (var entry : source.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof TomlTable nested) {
                flatten(key + ".", nested.toMap(), out);
            } else if (value instanceof Map<?, ?> nested) {
                var copy = new LinkedHashMap<String, Object>();
                nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
                flatten(key + ".", copy, out);
            } else {
                out.put(key, String.valueOf(value));
            }
        }
    }

    private static boolean flag(TomlTable table, String key, boolean fallback) {
        Boolean value = table.getBoolean(key);
        return value == null ? fallback : value;
    }

    private static Path path(Path project, TomlTable table, String key, Path fallback) {
        String value = table.getString(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return project.resolve(value).normalize();
    }
}

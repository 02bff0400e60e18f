package work.lcod.staging.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.staging.defaults.MergeOptions;
import work.lcod.staging.pipeline.ProjectCoordinates;
import work.lcod.staging.pipeline.StagingLayout;
import work.lcod.staging.target.Target;
import work.lcod.staging.target.Template;

/**
 * Immutable configuration of one staging run.
 *
 * @param templates target templates; empty means the built-in properties and XML templates
 * @param targets targets declared directly, merged over the discovered ones
 */
public record StagingConfiguration(
    ProjectCoordinates coordinates,
    StagingLayout layout,
    MergeOptions mergeOptions,
    boolean includeAllResources,
    boolean strictRendering,
    Map<String, String> contextValues,
    List<Template> templates,
    Map<String, Target> targets,
    boolean dryRun,
    LogLevel logLevel
) {
    public static final String DEFAULT_VERSION = "unspecified";

    public StagingConfiguration {
        Objects.requireNonNull(coordinates, "coordinates");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(mergeOptions, "mergeOptions");
        Objects.requireNonNull(logLevel, "logLevel");
        contextValues = Collections.unmodifiableMap(new LinkedHashMap<>(contextValues));
        templates = List.copyOf(templates);
        targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path projectDir;
        private String group = "";
        private String artifactId;
        private String version = DEFAULT_VERSION;
        private StagingLayout layout;
        private MergeOptions mergeOptions = MergeOptions.defaults();
        private boolean includeAllResources;
        private boolean strictRendering;
        private final Map<String, String> contextValues = new LinkedHashMap<>();
        private final List<Template> templates = new ArrayList<>();
        private final Map<String, Target> targets = new LinkedHashMap<>();
        private boolean dryRun;
        private LogLevel logLevel = LogLevel.WARN;

        public Builder projectDir(Path projectDir) {
            this.projectDir = projectDir;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder artifactId(String artifactId) {
            this.artifactId = artifactId;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder layout(StagingLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder mergeOptions(MergeOptions mergeOptions) {
            this.mergeOptions = mergeOptions;
            return this;
        }

        public Builder includeAllResources(boolean includeAllResources) {
            this.includeAllResources = includeAllResources;
            return this;
        }

        public Builder strictRendering(boolean strictRendering) {
            this.strictRendering = strictRendering;
            return this;
        }

        public Builder contextValue(String key, String value) {
            this.contextValues.put(key, value);
            return this;
        }

        public Builder contextValues(Map<String, String> values) {
            this.contextValues.putAll(values);
            return this;
        }

        public Builder template(Template template) {
            this.templates.add(template);
            return this;
        }

        public Builder templates(List<Template> templates) {
            this.templates.addAll(templates);
            return this;
        }

        public Builder target(Target target) {
            this.targets.put(target.name(), target);
            return this;
        }

        public Builder targets(Map<String, Target> targets) {
            this.targets.putAll(targets);
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public StagingConfiguration build() {
            StagingLayout resolvedLayout = layout;
            if (resolvedLayout == null) {
                Objects.requireNonNull(projectDir, "projectDir or layout is required");
                resolvedLayout = StagingLayout.conventional(projectDir);
            }
            String resolvedArtifactId = artifactId != null && !artifactId.isBlank()
                ? artifactId
                : String.valueOf(resolvedLayout.projectDir().getFileName());
            return new StagingConfiguration(
                new ProjectCoordinates(group, resolvedArtifactId, version),
                resolvedLayout,
                mergeOptions,
                includeAllResources,
                strictRendering,
                contextValues,
                templates,
                targets,
                dryRun,
                logLevel
            );
        }
    }
}

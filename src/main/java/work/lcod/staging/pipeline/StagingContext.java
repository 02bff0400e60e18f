package work.lcod.staging.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.staging.artifact.ArchiveWriter;
import work.lcod.staging.artifact.ArtifactCache;
import work.lcod.staging.artifact.LocalRepositoryPublicationSink;
import work.lcod.staging.artifact.Publication;
import work.lcod.staging.artifact.PublicationSink;
import work.lcod.staging.artifact.ZipArchiveWriter;
import work.lcod.staging.render.PlaceholderRenderer;
import work.lcod.staging.render.TemplateRenderer;

/**
 * State and collaborators of one staging run, passed to every stage-construction call.
 */
public final class StagingContext {
    private final StagingLayout layout;
    private final ProjectCoordinates coordinates;
    private final boolean includeAllResources;
    private final Map<String, String> contextValues;
    private final TemplateRenderer renderer;
    private final ArchiveWriter archiveWriter;
    private final PublicationSink publicationSink;
    private final StageRegistry stages = new StageRegistry();
    private final ArtifactCache artifactCache = new ArtifactCache();
    private final List<Publication> publications = Collections.synchronizedList(new ArrayList<>());

    private StagingContext(Builder builder) {
        this.layout = Objects.requireNonNull(builder.layout, "layout");
        this.coordinates = Objects.requireNonNull(builder.coordinates, "coordinates");
        this.includeAllResources = builder.includeAllResources;
        this.contextValues = Collections.unmodifiableMap(new LinkedHashMap<>(builder.contextValues));
        this.renderer = builder.renderer != null ? builder.renderer : new PlaceholderRenderer();
        this.archiveWriter = builder.archiveWriter != null ? builder.archiveWriter : new ZipArchiveWriter();
        this.publicationSink = builder.publicationSink != null
            ? builder.publicationSink
            : new LocalRepositoryPublicationSink(layout.repositoryDir());
    }

    public static Builder builder() {
        return new Builder();
    }

    public StagingLayout layout() {
        return layout;
    }

    public ProjectCoordinates coordinates() {
        return coordinates;
    }

    public boolean includeAllResources() {
        return includeAllResources;
    }

    /** Values every render stage starts from; target context values override them. */
    public Map<String, String> contextValues() {
        return contextValues;
    }

    public TemplateRenderer renderer() {
        return renderer;
    }

    public ArchiveWriter archiveWriter() {
        return archiveWriter;
    }

    public PublicationSink publicationSink() {
        return publicationSink;
    }

    public StageRegistry stages() {
        return stages;
    }

    public ArtifactCache artifactCache() {
        return artifactCache;
    }

    public List<Publication> publications() {
        synchronized (publications) {
            return List.copyOf(publications);
        }
    }

    void addPublication(Publication publication) {
        publications.add(publication);
    }

    public static final class Builder {
        private StagingLayout layout;
        private ProjectCoordinates coordinates;
        private boolean includeAllResources;
        private Map<String, String> contextValues = Map.of();
        private TemplateRenderer renderer;
        private ArchiveWriter archiveWriter;
        private PublicationSink publicationSink;

        public Builder layout(StagingLayout layout) {
            this.layout = layout;
            return this;
        }

        public Builder coordinates(ProjectCoordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder includeAllResources(boolean includeAllResources) {
            this.includeAllResources = includeAllResources;
            return this;
        }

        public Builder contextValues(Map<String, String> contextValues) {
            this.contextValues = contextValues == null ? Map.of() : contextValues;
            return this;
        }

        public Builder renderer(TemplateRenderer renderer) {
            this.renderer = renderer;
            return this;
        }

        public Builder archiveWriter(ArchiveWriter archiveWriter) {
            this.archiveWriter = archiveWriter;
            return this;
        }

        public Builder publicationSink(PublicationSink publicationSink) {
            this.publicationSink = publicationSink;
            return this;
        }

        public StagingContext build() {
            return new StagingContext(this);
        }
    }
}

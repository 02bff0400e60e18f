package work.lcod.staging.pipeline;

import java.io.IOException;
import work.lcod.staging.artifact.Publication;
import work.lcod.staging.artifact.PublicationSink;

/**
 * Hands a target's publication to the publication sink.
 */
public final class PublishStage extends AbstractStage {
    private final Publication publication;
    private final PublicationSink sink;

    PublishStage(String targetName, Publication publication, PublicationSink sink) {
        super(StageKind.PUBLISH.stageName(targetName), StageKind.PUBLISH, targetName);
        this.publication = publication;
        this.sink = sink;
    }

    public Publication publication() {
        return publication;
    }

    @Override
    public void execute() throws IOException {
        sink.publish(publication);
    }
}

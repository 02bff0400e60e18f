package work.lcod.staging.artifact;

import java.io.IOException;

/**
 * Receives publications once their artifact has been built.
 */
@FunctionalInterface
public interface PublicationSink {
    void publish(Publication publication) throws IOException;
}

package work.lcod.staging.artifact;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run registry guaranteeing at most one archive artifact and one publication per target name.
 *
 * <p>Both operations are atomic per instance, so configuration may be issued from several threads.
 * A factory or registration callback must not call back into the same cache.</p>
 */
public final class ArtifactCache {
    private static final Logger log = LoggerFactory.getLogger(ArtifactCache.class);

    private final Map<String, ArtifactHandle> artifacts = new LinkedHashMap<>();
    private final Set<String> published = new HashSet<>();

    /**
     * Returns the handle cached for {@code targetName}, creating it with {@code factory} on first use.
     * Later factories are never invoked.
     */
    public synchronized ArtifactHandle getOrCreate(String targetName, Supplier<ArtifactHandle> factory) {
        Objects.requireNonNull(targetName, "targetName");
        ArtifactHandle existing = artifacts.get(targetName);
        if (existing != null) {
            log.debug("Reusing artifact for {}: {}", targetName, existing.file());
            return existing;
        }
        ArtifactHandle created = Objects.requireNonNull(factory.get(), "factory returned null");
        artifacts.put(targetName, created);
        log.info("Created artifact for {}: {}", targetName, created.file());
        return created;
    }

    /**
     * Runs {@code registerFn} the first time it is called for {@code targetName}; later calls do
     * nothing. A registration that throws is not recorded.
     */
    public synchronized void registerPublicationOnce(String targetName, ArtifactHandle artifact, Runnable registerFn) {
        Objects.requireNonNull(targetName, "targetName");
        if (published.contains(targetName)) {
            log.debug("Publication for {} already registered", targetName);
            return;
        }
        registerFn.run();
        published.add(targetName);
        log.info("Registered publication of {} for {}", artifact.file().getFileName(), targetName);
    }

    public synchronized Map<String, ArtifactHandle> artifacts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(artifacts));
    }

    public synchronized boolean isPublished(String targetName) {
        return published.contains(targetName);
    }
}

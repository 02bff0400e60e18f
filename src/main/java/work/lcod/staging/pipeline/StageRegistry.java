package work.lcod.staging.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Stages of one run, keyed by name in creation order.
 */
public final class StageRegistry {
    private final Map<String, Stage> stages = new LinkedHashMap<>();

    public synchronized Optional<Stage> find(String name) {
        return Optional.ofNullable(stages.get(name));
    }

    public Stage require(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException("Stage not registered: " + name));
    }

    /**
     * Returns the stage registered under {@code name}, creating and registering it on first use.
     *
     * @throws IllegalStateException if the registered stage is not of the requested type
     */
    public synchronized <S extends Stage> S getOrCreate(String name, Class<S> type, Supplier<S> factory) {
        Stage existing = stages.get(name);
        if (existing != null) {
            if (!type.isInstance(existing)) {
                throw new IllegalStateException("Stage " + name + " is a " + existing.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
            }
            return type.cast(existing);
        }
        S created = factory.get();
        stages.put(name, created);
        return created;
    }

    public synchronized boolean contains(String name) {
        return stages.containsKey(name);
    }

    public synchronized List<Stage> stages() {
        return List.copyOf(stages.values());
    }

    public synchronized Map<String, Stage> asMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stages));
    }
}

package work.lcod.staging.target;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A named deployment target with its optional configuration context.
 *
 * <p>The name is not validated here; targets can be supplied directly and are checked when the
 * stages are configured.</p>
 */
public record Target(String name, Optional<Map<String, String>> context) {
    public Target {
        Objects.requireNonNull(context, "context");
        context = context.map(values -> Collections.unmodifiableMap(new TreeMap<>(values)));
    }

    public static Target of(String name, Map<String, String> context) {
        return new Target(name, Optional.of(context));
    }

    public static Target withoutContext(String name) {
        return new Target(name, Optional.empty());
    }

    /**
     * Reads the loose map form ({@code name}, optional {@code context}) accepted when targets are
     * declared directly rather than discovered.
     */
    public static Target fromMap(Map<String, ?> values) {
        Object rawName = values.get("name");
        String name = rawName == null ? null : String.valueOf(rawName);
        Object rawContext = values.get("context");
        if (!(rawContext instanceof Map<?, ?> map)) {
            return withoutContext(name);
        }
        var context = new TreeMap<String, String>();
        map.forEach((key, value) -> context.put(String.valueOf(key), value == null ? "" : String.valueOf(value)));
        return of(name, context);
    }

    public boolean hasName() {
        return name != null && !name.isBlank();
    }

    public boolean hasContext() {
        return context.isPresent();
    }
}

package work.lcod.staging.defaults;

import java.util.List;
import java.util.SortedSet;
import work.lcod.staging.shared.StagingException;

/**
 * Generated property files in one batch define different key sets.
 */
public final class StructuralInconsistencyException extends StagingException {
    private final List<String> offendingKeys;

    public StructuralInconsistencyException(SortedSet<String> offendingKeys) {
        super("structural_inconsistency",
            "Detected disjoint property sets: \n\t" + String.join("\n\t", offendingKeys));
        this.offendingKeys = List.copyOf(offendingKeys);
    }

    /** The distinct keys missing from at least one property set, sorted. */
    public List<String> offendingKeys() {
        return offendingKeys;
    }
}

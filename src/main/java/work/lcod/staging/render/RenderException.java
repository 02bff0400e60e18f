package work.lcod.staging.render;

import java.nio.file.Path;
import java.util.List;
import work.lcod.staging.shared.StagingException;

/**
 * A template referenced context values that were not defined.
 */
public final class RenderException extends StagingException {
    private final List<String> missing;

    public RenderException(Path template, List<String> missing) {
        super("render_failed", "Undefined values " + missing + " in template " + template);
        this.missing = List.copyOf(missing);
    }

    public List<String> missing() {
        return missing;
    }
}

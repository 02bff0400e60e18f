package work.lcod.staging.defaults;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * The default lines read from one defaults file.
 *
 * @param relativePath path of the defaults file relative to the defaults root
 * @param basename file name with the defaults suffix removed; selects the templates it applies to
 * @param lines the non-blank, non-comment lines of the file, in file order
 */
public record DefaultsEntry(Path relativePath, String basename, List<String> lines) {
    public DefaultsEntry {
        Objects.requireNonNull(relativePath, "relativePath");
        Objects.requireNonNull(basename, "basename");
        lines = List.copyOf(lines);
    }
}

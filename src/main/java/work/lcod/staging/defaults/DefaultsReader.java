package work.lcod.staging.defaults;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import work.lcod.staging.shared.FileTrees;

/**
 * Collects the defaults files below a defaults root.
 */
public final class DefaultsReader {
    private DefaultsReader() {}

    /**
     * Finds every file ending with {@code suffix} below {@code defaultsRoot}, recursively. A missing
     * root yields no entries.
     */
    public static List<DefaultsEntry> read(Path defaultsRoot, String suffix) throws IOException {
        var entries = new ArrayList<DefaultsEntry>();
        if (defaultsRoot == null || !Files.isDirectory(defaultsRoot)) {
            return entries;
        }
        for (Path file : FileTrees.listFiles(defaultsRoot, path -> path.getFileName().toString().endsWith(suffix))) {
            entries.add(read(defaultsRoot, file, suffix));
        }
        return entries;
    }

    static DefaultsEntry read(Path defaultsRoot, Path file, String suffix) throws IOException {
        String fileName = file.getFileName().toString();
        String basename = fileName.substring(0, fileName.length() - suffix.length());
        List<String> lines = Files.readAllLines(file, PropertiesGenerator.PROPERTIES_CHARSET).stream()
            .filter(line -> !line.trim().isEmpty())
            .filter(line -> !isComment(line))
            .collect(Collectors.toList());
        return new DefaultsEntry(defaultsRoot.relativize(file), basename, lines);
    }

    static boolean isComment(String line) {
        String trimmed = line.trim();
        return trimmed.startsWith("#") || trimmed.startsWith("!");
    }
}

package work.lcod.staging.defaults;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structural comparison of generated property files.
 */
public final class PropertySets {
    private PropertySets() {}

    public static Map<String, String> read(Path file) throws IOException {
        var properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        }
        var map = new TreeMap<String, String>();
        for (String key : properties.stringPropertyNames()) {
            map.put(key, properties.getProperty(key));
        }
        return map;
    }

    public static List<Map<String, String>> readAll(List<Path> files) throws IOException {
        var sets = new ArrayList<Map<String, String>>(files.size());
        for (Path file : files) {
            sets.add(read(file));
        }
        return sets;
    }

    /**
     * Returns the union of the symmetric differences of the key sets of every unordered pair.
     * The result is empty exactly when all sets define the same keys.
     */
    public static SortedSet<String> difference(List<Map<String, String>> propertySets) {
        var difference = new TreeSet<String>();
        for (int i = 0; i < propertySets.size(); i++) {
            for (int j = i + 1; j < propertySets.size(); j++) {
                difference.addAll(symmetricDifference(propertySets.get(i).keySet(), propertySets.get(j).keySet()));
            }
        }
        return difference;
    }

    public static void requireSameKeys(List<Map<String, String>> propertySets) {
        SortedSet<String> difference = difference(propertySets);
        if (!difference.isEmpty()) {
            throw new StructuralInconsistencyException(difference);
        }
    }

    static Set<String> symmetricDifference(Set<String> left, Set<String> right) {
        var result = new HashSet<String>(left);
        result.addAll(right);
        var common = new HashSet<String>(left);
        common.retainAll(right);
        result.removeAll(common);
        return result;
    }
}

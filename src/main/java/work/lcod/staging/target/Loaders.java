package work.lcod.staging.target;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import work.lcod.staging.shared.InvalidConfigurationException;

/**
 * Built-in {@link PropertiesLoader} implementations.
 */
public final class Loaders {
    /** Format names accepted by {@link #forFormat(String)}; {@code yml} is an alias of {@code yaml}. */
    public static final List<String> FORMATS = List.of("properties", "xml", "json", "yaml");

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private Loaders() {}

    /** Line-based {@code key=value} files, as read by {@link Properties#load(InputStream)}. */
    public static PropertiesLoader properties() {
        return stream -> {
            var properties = new Properties();
            properties.load(stream);
            return toMap(properties);
        };
    }

    /** Property XML documents, as read by {@link Properties#loadFromXML(InputStream)}. */
    public static PropertiesLoader xmlProperties() {
        return stream -> {
            var properties = new Properties();
            properties.loadFromXML(stream);
            return toMap(properties);
        };
    }

    /** JSON objects; nested objects are flattened into dotted keys. */
    public static PropertiesLoader json() {
        return stream -> flatten(readTree(JSON, stream));
    }

    /** YAML mappings; nested mappings are flattened into dotted keys. */
    public static PropertiesLoader yaml() {
        return stream -> flatten(readTree(YAML, stream));
    }

    public static PropertiesLoader forFormat(String format) {
        if (format == null || format.isBlank()) {
            return properties();
        }
        return switch (format.trim().toLowerCase(Locale.ROOT)) {
            case "properties" -> properties();
            case "xml" -> xmlProperties();
            case "json" -> json();
            case "yaml", "yml" -> yaml();
            default -> throw new InvalidConfigurationException(
                "Unsupported target format: " + format + " (expected one of " + FORMATS + ")");
        };
    }

    static Map<String, String> toMap(Properties properties) {
        var map = new TreeMap<String, String>();
        for (String key : properties.stringPropertyNames()) {
            map.put(key, properties.getProperty(key));
        }
        return map;
    }

    private static Map<String, Object> readTree(ObjectMapper mapper, InputStream stream) throws IOException {
        Map<String, Object> parsed = mapper.readValue(stream, MAP_REF);
        return parsed == null ? Map.of() : parsed;
    }

    private static Map<String, String> flatten(Map<String, Object> source) {
        var flat = new LinkedHashMap<String, String>();
        flattenInto("", source, flat);
        return flat;
    }

    private static void flattenInto(String prefix, Map<?, ?> source, Map<String, String> out) {
        for (var entry : source.entrySet()) {
            String key = prefix + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                flattenInto(key + ".", nested, out);
            } else if (value instanceof List<?> list) {
                for (int i = 0; i < list.size(); i++) {
                    out.put(key + "." + i, String.valueOf(list.get(i)));
                }
            } else {
                out.put(key, value == null ? "" : String.valueOf(value));
            }
        }
    }
}

package work.lcod.staging.target;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Converts the byte stream of a target definition file into its property mapping.
 */
@FunctionalInterface
public interface PropertiesLoader {
    Map<String, String> load(InputStream stream) throws IOException;
}

package work.lcod.staging.render;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.Map;
import work.lcod.staging.defaults.PropertiesGenerator;

/**
 * Renders one template file against a context.
 */
@FunctionalInterface
public interface TemplateRenderer {
    String render(Path template, Map<String, String> context) throws IOException;

    /** Encoding of templates and rendered files; they are the generated property files. */
    default Charset charset() {
        return PropertiesGenerator.PROPERTIES_CHARSET;
    }
}

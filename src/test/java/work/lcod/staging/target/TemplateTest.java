package work.lcod.staging.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import work.lcod.staging.shared.InvalidConfigurationException;

class TemplateTest {
    @Test
    void extractsNameFromFirstGroup() {
        assertEquals(Optional.of("dev"), Templates.PROPERTIES.extractName("dev.properties"));
        assertEquals(Optional.of("prod-eu"), Templates.XML_PROPERTIES.extractName("prod-eu.xml"));
    }

    @Test
    void builtInMaskExcludesDots() {
        assertEquals(Optional.of("b"), Templates.PROPERTIES.extractName("a.b.properties"));
    }

    @Test
    void nullLoaderFallsBackToProperties() throws Exception {
        var template = Template.of("(x)", null);
        var values = template.load(new ByteArrayInputStream("k=v\n".getBytes(StandardCharsets.ISO_8859_1)));
        assertEquals(Map.of("k", "v"), values);
    }

    @Test
    void rejectsInvalidMask() {
        assertThrows(InvalidConfigurationException.class, () -> Template.of("([a-z"));
    }

    @Test
    void buildsFromMap() {
        var values = new LinkedHashMap<String, Object>();
        values.put("pattern", Pattern.compile("(.*)\\.json"));
        values.put("load", Loaders.json());
        var template = Template.fromMap(values);

        assertTrue(template.matches("dev.json"));
        assertFalse(template.matches("dev.yaml"));
        assertEquals("(.*)\\.json", template.patternSource());
    }

    @Test
    void fromMapRequiresPatternOrMask() {
        assertThrows(InvalidConfigurationException.class, () -> Template.fromMap(Map.of("load", Loaders.json())));
    }
}

package work.lcod.staging.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.staging.support.StagingTestSupport.write;
import static work.lcod.staging.support.StagingTestSupport.xmlProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.staging.shared.InvalidConfigurationException;

class TargetDiscoveryTest {
    @TempDir
    Path targetsDir;

    @Test
    void parsesPropertiesTargets() throws Exception {
        write(targetsDir.resolve("t1.properties"), "\na=1\n");
        write(targetsDir.resolve("t2.properties"), "\na=2\n");

        var targets = TargetDiscovery.discover(targetsDir, Templates.PROPERTIES);

        assertEquals(2, targets.size());
        assertEquals(Target.of("t1", Map.of("a", "1")), targets.get("t1"));
        assertEquals(Target.of("t2", Map.of("a", "2")), targets.get("t2"));
    }

    @Test
    void parsesXmlTargets() throws Exception {
        write(targetsDir.resolve("t1.xml"), xmlProperties(Map.of("a", "1")));
        write(targetsDir.resolve("t2.xml"), xmlProperties(Map.of("a", "2")));

        var targets = TargetDiscovery.discover(targetsDir, Templates.XML_PROPERTIES);

        assertEquals(2, targets.size());
        assertEquals("t1", targets.get("t1").name());
        assertEquals(Map.of("a", "1"), targets.get("t1").context().orElseThrow());
        assertEquals(Map.of("a", "2"), targets.get("t2").context().orElseThrow());
    }

    @Test
    void usesBuiltInTemplatesWhenNoneRegistered() throws Exception {
        write(targetsDir.resolve("dev.properties"), "host=localhost\n");
        write(targetsDir.resolve("prod.xml"), xmlProperties(Map.of("host", "example.com")));
        write(targetsDir.resolve("README.md"), "not a target\n");

        var targets = TargetDiscovery.discover(targetsDir);

        assertEquals(List.of("dev", "prod"), List.copyOf(targets.keySet()));
        assertEquals("example.com", targets.get("prod").context().orElseThrow().get("host"));
    }

    @Test
    void laterTemplateWinsOnNameCollision() throws Exception {
        write(targetsDir.resolve("t1.properties"), "source=properties\n");
        write(targetsDir.resolve("t1.xml"), xmlProperties(Map.of("source", "xml")));

        var xmlLast = TargetDiscovery.discover(targetsDir, List.of(Templates.PROPERTIES, Templates.XML_PROPERTIES));
        var propertiesLast = TargetDiscovery.discover(targetsDir, List.of(Templates.XML_PROPERTIES, Templates.PROPERTIES));

        assertEquals("xml", xmlLast.get("t1").context().orElseThrow().get("source"));
        assertEquals("properties", propertiesLast.get("t1").context().orElseThrow().get("source"));
    }

    @Test
    void matchesAnywhereInTheFileName() throws Exception {
        write(targetsDir.resolve("env-qa.cfg"), "a=1\n");
        var template = Template.of("env-([a-z]+)\\.cfg");

        var targets = TargetDiscovery.discover(targetsDir, List.of(template));

        assertEquals(Map.of("a", "1"), targets.get("qa").context().orElseThrow());
    }

    @Test
    void failsWhenPatternHasNoCaptureGroup() throws Exception {
        write(targetsDir.resolve("t1.properties"), "a=1\n");
        var template = Template.of(Pattern.compile("\\.properties$"));

        var thrown = assertThrows(TargetNameParseException.class,
            () -> TargetDiscovery.discover(targetsDir, List.of(template)));

        assertEquals("t1.properties", thrown.fileName());
        assertEquals("\\.properties$", thrown.patternSource());
        assertEquals("target_name_parse", thrown.code());
    }

    @Test
    void failsWhenCapturedNameIsEmpty() throws Exception {
        write(targetsDir.resolve(".properties"), "a=1\n");

        assertThrows(TargetNameParseException.class,
            () -> TargetDiscovery.discover(targetsDir, Templates.PROPERTIES));
    }

    @Test
    void failsWhenLoaderRejectsContent() throws Exception {
        Path broken = write(targetsDir.resolve("t1.xml"), "<properties><entry key=");

        var thrown = assertThrows(TargetParseException.class,
            () -> TargetDiscovery.discover(targetsDir, Templates.XML_PROPERTIES));

        assertEquals(broken, thrown.file());
        assertTrue(thrown.getMessage().contains(broken.toAbsolutePath().toString()));
        assertInstanceOf(java.io.IOException.class, thrown.getCause());
    }

    @Test
    void emptyDirectoryYieldsNoTargets() {
        assertTrue(TargetDiscovery.discover(targetsDir).isEmpty());
    }

    @Test
    void rejectsMissingDirectory() {
        assertThrows(InvalidConfigurationException.class,
            () -> TargetDiscovery.discover(targetsDir.resolve("missing")));
    }

    @Test
    void ignoresDirectoriesMatchingThePattern() throws Exception {
        Files.createDirectories(targetsDir.resolve("nested.properties"));
        write(targetsDir.resolve("t1.properties"), "a=1\n");

        var targets = TargetDiscovery.discover(targetsDir);

        assertEquals(List.of("t1"), List.copyOf(targets.keySet()));
        assertFalse(targets.containsKey("nested"));
    }
}

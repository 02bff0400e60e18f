package work.lcod.staging.defaults;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.staging.support.StagingTestSupport.lines;
import static work.lcod.staging.support.StagingTestSupport.write;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PropertiesGeneratorTest {
    @TempDir
    Path root;

    Path defaultsDir;
    Path templatesDir;
    Path outputDir;

    @BeforeEach
    void layout() {
        defaultsDir = root.resolve("defaults");
        templatesDir = root.resolve("templates");
        outputDir = root.resolve("out");
    }

    @Test
    void defaultsPrecedeOwnLinesByDefault() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\ny=2\n");
        write(templatesDir.resolve("app.properties"), "y=3\n");

        var generated = PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, MergeOptions.defaults());

        assertEquals(List.of(outputDir.resolve("app.properties")), generated);
        assertEquals(List.of("x=1", "y=2", "y=3"), lines(outputDir.resolve("app.properties")));
    }

    @Test
    void prependPlacesOwnLinesFirst() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\ny=2\n");
        write(templatesDir.resolve("app.properties"), "y=3\n");

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.builder().prepend(true).build());

        assertEquals(List.of("y=3", "x=1", "y=2"), lines(outputDir.resolve("app.properties")));
    }

    @Test
    void sortAppliesAcrossDefaultsAndOwnLines() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "m=1\nz=2\n");
        write(templatesDir.resolve("app.properties"), "a=3\nn=4\n");

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.builder().sort(true).build());

        assertEquals(List.of("a=3", "m=1", "n=4", "z=2"), lines(outputDir.resolve("app.properties")));
    }

    @Test
    void trimDropsBlankLinesFromTemplates() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\n\n   \n");
        write(templatesDir.resolve("app.properties"), "\ny=3\n   \nz=4");

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.builder().trim(true).build());

        assertEquals(List.of("x=1", "y=3", "z=4"), lines(outputDir.resolve("app.properties")));
    }

    @Test
    void withoutTrimBlankTemplateLinesAreKept() {
        var merged = PropertiesGenerator.merge(List.of("x=1"), List.of("", "y=3"), MergeOptions.defaults());
        assertEquals(List.of("x=1", "", "y=3"), merged);
    }

    @Test
    void appliesDefaultsToEveryTemplateStartingWithBasename() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\n");
        write(templatesDir.resolve("app-dev.properties"), "y=dev\n");
        write(templatesDir.resolve("app-prod.properties"), "y=prod\n");
        write(templatesDir.resolve("other.properties"), "z=1\n");

        var generated = PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, MergeOptions.defaults());

        assertEquals(List.of(outputDir.resolve("app-dev.properties"), outputDir.resolve("app-prod.properties")), generated);
        assertEquals(List.of("x=1", "y=prod"), lines(outputDir.resolve("app-prod.properties")));
        assertFalse(Files.exists(outputDir.resolve("other.properties")));
    }

    @Test
    void mirrorsRelativePathOfDefaultsFile() throws Exception {
        write(defaultsDir.resolve("conf/db/db.defaults.vtl"), "pool=10\n");
        write(templatesDir.resolve("conf/db/db.properties"), "url=jdbc:h2:mem\n");

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, MergeOptions.defaults());

        assertEquals(List.of("pool=10", "url=jdbc:h2:mem"), lines(outputDir.resolve("conf/db/db.properties")));
    }

    @Test
    void honoursCustomDefaultsExtension() throws Exception {
        write(defaultsDir.resolve("app.defaults"), "x=1\n");
        write(defaultsDir.resolve("app.defaults.vtl"), "ignored=1\n");
        write(templatesDir.resolve("app.properties"), "y=3\n");

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.builder().defaultsFileExtension(".defaults").build());

        assertEquals(List.of("x=1", "y=3"), lines(outputDir.resolve("app.properties")));
    }

    @Test
    void regenerationIsByteIdentical() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "b=1\n# comment\na=2\n");
        write(templatesDir.resolve("app.properties"), "c=3\n\n");
        var options = MergeOptions.builder().sort(true).trim(true).build();

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, options);
        byte[] first = Files.readAllBytes(outputDir.resolve("app.properties"));
        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, options);
        byte[] second = Files.readAllBytes(outputDir.resolve("app.properties"));

        assertArrayEquals(first, second);
    }

    @Test
    void carriesLatin1BytesThroughUnchanged() throws Exception {
        Files.createDirectories(defaultsDir);
        Files.createDirectories(templatesDir);
        Files.write(defaultsDir.resolve("app.defaults.vtl"), "region=r\u00e9gion\n".getBytes(StandardCharsets.ISO_8859_1));
        Files.write(templatesDir.resolve("app.properties"), "city=Z\u00fcrich\n".getBytes(StandardCharsets.ISO_8859_1));

        PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.builder().structured(true).build());

        byte[] expected = ("region=r\u00e9gion" + System.lineSeparator() + "city=Z\u00fcrich")
            .getBytes(StandardCharsets.ISO_8859_1);
        assertArrayEquals(expected, Files.readAllBytes(outputDir.resolve("app.properties")));
        assertEquals("Z\u00fcrich", PropertySets.read(outputDir.resolve("app.properties")).get("city"));
    }

    @Test
    void copiesTemplatesWhenNoDefaultsExist() throws Exception {
        write(templatesDir.resolve("app.properties"), "a=1\n");
        write(templatesDir.resolve("nested/app.conf"), "port=${port}\n");

        var copied = PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, MergeOptions.defaults());

        assertEquals(2, copied.size());
        assertEquals("a=1\n", Files.readString(outputDir.resolve("app.properties")));
        assertEquals("port=${port}\n", Files.readString(outputDir.resolve("nested/app.conf")));
    }

    @Test
    void skipsWhenTemplatesDirectoryIsMissing() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\n");

        var generated = PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir, MergeOptions.defaults());

        assertTrue(generated.isEmpty());
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void structuredModeAcceptsMatchingKeySets() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\n");
        write(templatesDir.resolve("app-dev.properties"), "y=dev\n");
        write(templatesDir.resolve("app-prod.properties"), "y=prod\n");

        assertDoesNotThrow(() -> PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.builder().structured(true).build()));
    }

    @Test
    void structuredModeReportsSymmetricDifference() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\n");
        write(templatesDir.resolve("app-dev.properties"), "y=dev\nonly.dev=1\n");
        write(templatesDir.resolve("app-prod.properties"), "y=prod\nonly.prod=1\nalso.prod=2\n");

        var thrown = assertThrows(StructuralInconsistencyException.class,
            () -> PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
                MergeOptions.builder().structured(true).build()));

        assertEquals(List.of("also.prod", "only.dev", "only.prod"), thrown.offendingKeys());
        assertEquals("Detected disjoint property sets: \n\talso.prod\n\tonly.dev\n\tonly.prod", thrown.getMessage());
        assertTrue(Files.exists(outputDir.resolve("app-prod.properties")));
    }

    @Test
    void structuredModeChecksCopiedTemplates() throws Exception {
        write(templatesDir.resolve("a.properties"), "k=1\n");
        write(templatesDir.resolve("b.properties"), "j=1\n");

        var thrown = assertThrows(StructuralInconsistencyException.class,
            () -> PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
                MergeOptions.builder().structured(true).build()));

        assertEquals(List.of("j", "k"), thrown.offendingKeys());
    }

    @Test
    void semiStructuredModeAllowsDisjointKeySets() throws Exception {
        write(defaultsDir.resolve("app.defaults.vtl"), "x=1\n");
        write(templatesDir.resolve("app-dev.properties"), "only.dev=1\n");
        write(templatesDir.resolve("app-prod.properties"), "only.prod=1\n");

        assertDoesNotThrow(() -> PropertiesGenerator.mergeDefaults(defaultsDir, templatesDir, outputDir,
            MergeOptions.defaults()));
    }
}

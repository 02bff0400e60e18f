package work.lcod.staging.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TargetTest {
    @Test
    void readsLooseMapForm() {
        var target = Target.fromMap(Map.of("name", "dev", "context", Map.of("port", 8080)));
        assertEquals("dev", target.name());
        assertEquals(Map.of("port", "8080"), target.context().orElseThrow());
    }

    @Test
    void mapWithoutContextHasNoContext() {
        var target = Target.fromMap(Map.of("name", "dev"));
        assertTrue(target.hasName());
        assertFalse(target.hasContext());
    }

    @Test
    void missingNameIsKeptForLaterValidation() {
        var target = Target.fromMap(Map.of("context", Map.of()));
        assertNull(target.name());
        assertFalse(target.hasName());
    }
}

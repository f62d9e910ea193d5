package work.lcod.notegen.resolution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PathSetterTest {
    @Test
    void createsIntermediateObjects() {
        var root = new LinkedHashMap<String, Object>();
        PathSetter.set(root, "a.b.c", 1);
        assertEquals(Map.of("a", Map.of("b", Map.of("c", 1))), root);
    }

    @Test
    void padsIndexedSlotsWithNulls() {
        var root = new LinkedHashMap<String, Object>();
        PathSetter.set(root, "codes[2]", "90837");
        assertEquals(Arrays.asList(null, null, "90837"), root.get("codes"));
        PathSetter.set(root, "rows[1].label", "second");
        assertEquals(Arrays.asList(null, Map.of("label", "second")), root.get("rows"));
    }

    @Test
    void mergesObjectWritesIntoExistingObjects() {
        var root = new LinkedHashMap<String, Object>();
        PathSetter.set(root, "excerpt.extra", "kept");
        PathSetter.set(root, "excerpt", Map.of("text", "hello"));
        assertEquals(Map.of("extra", "kept", "text", "hello"), root.get("excerpt"));
    }

    @Test
    void rejectsWritesThroughScalars() {
        var root = new LinkedHashMap<String, Object>();
        PathSetter.set(root, "header", "plain");
        var ex = assertThrows(PathConflictException.class, () -> PathSetter.set(root, "header.clinic", "x"));
        assertEquals("type_mismatch", ex.code());
        assertThrows(PathConflictException.class, () -> PathSetter.set(root, "list[].x", List.of()));
    }
}

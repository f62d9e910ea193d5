package work.lcod.notegen.composition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.notegen.support.NotegenTestSupport.model;
import static work.lcod.notegen.support.NotegenTestSupport.templateOf;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ContextSlicerTest {
    private static final Map<String, Object> SNAPSHOT = Map.of(
        "scores", Map.of("phq9", Map.of("current", 8)),
        "header", Map.of("clinic", "Riverside"),
        "session", Map.of("dx", List.of(Map.of("code", "F32.1")))
    );

    @Test
    void copiesTopLevelKeysOfDependencies() {
        var guide = FieldGuideBuilder.build(templateOf(
            model("a", "assessment.text", "scores.phq9.current", "source.risk"),
            model("b", "plan.text", "session.dx[].code")
        ));
        var slice = ContextSlicer.slice(SNAPSHOT, guide);
        assertEquals(List.of("scores", "session"), List.copyOf(slice.nasSlices().keySet()));
        assertEquals(SNAPSHOT.get("scores"), slice.nasSlices().get("scores"));
        assertFalse(slice.nasSlices().containsKey("header"));
        assertTrue(slice.issues().isEmpty());
    }

    @Test
    void missingDependencyIsWarning() {
        var guide = FieldGuideBuilder.build(templateOf(model("a", "assessment.text", "scores.phq9.current", "scores.gad7")));
        var slice = ContextSlicer.slice(SNAPSHOT, guide);
        assertEquals(1, slice.issues().size());
        var issue = slice.issues().get(0);
        assertEquals("context-slice.missing", issue.check());
        assertFalse(issue.isError());
        assertEquals("assessment.text", issue.path());
    }

    @Test
    void emptySliceIsError() {
        var guide = FieldGuideBuilder.build(templateOf(model("a", "assessment.text", "nothing.here")));
        var slice = ContextSlicer.slice(Map.of(), guide);
        assertTrue(slice.isEmpty());
        assertTrue(slice.issues().stream().anyMatch(issue -> "context-slice.empty".equals(issue.check()) && issue.isError()));
    }

    @Test
    void sourceOnlyDependenciesNeedNoSlice() {
        var guide = FieldGuideBuilder.build(templateOf(model("a", "assessment.text", "source.intake")));
        var slice = ContextSlicer.slice(Map.of(), guide);
        assertTrue(slice.isEmpty());
        assertTrue(slice.issues().isEmpty());
    }
}

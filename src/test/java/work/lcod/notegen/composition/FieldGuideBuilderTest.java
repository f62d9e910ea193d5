package work.lcod.notegen.composition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.notegen.support.NotegenTestSupport.model;
import static work.lcod.notegen.support.NotegenTestSupport.templateOf;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.notegen.support.NotegenTestSupport;
import work.lcod.notegen.template.ContentConstraints;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.SlotKind;
import work.lcod.notegen.template.StyleHints;
import work.lcod.notegen.template.TemplateWalker;

class FieldGuideBuilderTest {
    @Test
    void buildsEntriesInLayoutOrder() {
        var guide = FieldGuideBuilder.build(NotegenTestSupport.loadProgressNote());
        assertEquals(
            List.of("assessment.narrative", "assessment.risk", "plan.goals[]"),
            guide.entries().stream().map(FieldGuideEntry::path).collect(Collectors.toList())
        );
        assertTrue(guide.issues().isEmpty());

        var narrative = guide.entries().get(0);
        assertEquals("Clinical summary of the session.", narrative.description());
        assertEquals(List.of("Reference the change in PHQ-9 score."), narrative.guidance());
        assertEquals(20, narrative.constraints().minWords());
        assertEquals(Map.of("tone", "clinical"), narrative.style());

        var risk = guide.entries().get(1);
        assertEquals(DependencyScope.SOURCE, risk.dependencies().get(0).scope());
        assertEquals("risk.level", risk.dependencies().get(0).factPackPath());
        assertEquals(List.of("low", "moderate", "high"), risk.constraints().enumValues());
    }

    @Test
    void entryCountMatchesModelLeaves() {
        var nested = ContentItem.builder("goals", SlotKind.MODEL)
            .outputPath("plan.summary")
            .aiDeps(List.of("x"))
            .listItem(model("g0", "plan.goals[0]", "x"))
            .listItem(model("g1", "plan.goals[1]", "x"))
            .tableCell("col", model("cell", "plan.cell", "x"))
            .build();
        var template = templateOf(nested, model("other", "other.text", "x"));
        var guide = FieldGuideBuilder.build(template);
        assertEquals(TemplateWalker.countModelLeaves(template), guide.entries().size());
        assertEquals(
            List.of("plan.summary", "plan.goals[0]", "plan.goals[1]", "plan.cell", "other.text"),
            guide.entries().stream().map(FieldGuideEntry::path).collect(Collectors.toList())
        );
    }

    @Test
    void fallsBackToSourceAndDeduplicates() {
        var item = ContentItem.builder("summary", SlotKind.MODEL)
            .outputPath("assessment.summary")
            .source(List.of("source.intake.reason", "history", "history"))
            .build();
        var entry = FieldGuideBuilder.build(templateOf(item)).entries().get(0);
        assertEquals(2, entry.dependencies().size());
        assertEquals(DependencyScope.SOURCE, entry.dependencies().get(0).scope());
        assertEquals(DependencyScope.NAS, entry.dependencies().get(1).scope());
        assertNull(entry.constraints());
    }

    @Test
    void sourceNotesPrefixStaysInNonModelScope() {
        assertEquals(DependencyScope.NAS, DependencyScope.classify("sourceNotes.text"));
        assertEquals(DependencyScope.SOURCE, DependencyScope.classify("source"));
        assertEquals(DependencyScope.SOURCE, DependencyScope.classify("source.labs[].value"));
    }

    @Test
    void missingDependenciesAreErrors() {
        var item = ContentItem.builder("lonely", SlotKind.MODEL).outputPath("a.b").build();
        var guide = FieldGuideBuilder.build(templateOf(item));
        assertEquals(1, guide.issues().size());
        assertEquals("field-guide.dependencies", guide.issues().get(0).check());
        assertTrue(guide.issues().get(0).isError());
    }

    @Test
    void dropsUnknownStyleKeysWithWarnings() {
        var raw = new LinkedHashMap<String, Object>();
        raw.put("tone", "clinical");
        raw.put("unexpected", true);
        raw.put("tableCell", Map.of("columnIndex", 1, "unknown", "x"));
        var item = ContentItem.builder("styled", SlotKind.MODEL)
            .outputPath("a.b")
            .aiDeps(List.of("x"))
            .styleHints(StyleHints.fromMap(raw))
            .constraints(ContentConstraints.empty().withPattern("^[A-Z]"))
            .build();
        var guide = FieldGuideBuilder.build(templateOf(item));
        var entry = guide.entries().get(0);
        assertEquals(Map.of("tone", "clinical", "tableCell", Map.of("columnIndex", 1)), entry.style());
        assertEquals(2, guide.issues().size());
        assertTrue(guide.issues().stream().allMatch(issue -> "field-guide.style".equals(issue.check()) && !issue.isError()));
        assertEquals(Map.of("pattern", "^[A-Z]"), entry.constraints().toMap());
    }
}

package work.lcod.notegen.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.notegen.support.NotegenTestSupport;

class TemplateLoaderTest {
    @Test
    void loadsYamlFixture() {
        var template = NotegenTestSupport.loadProgressNote();
        assertEquals("progress-note", template.id());
        assertEquals("1.0.0", template.version());
        assertEquals("Progress Note", template.name());
        assertEquals(2, template.prompt().rules().size());
        assertEquals(5, template.layout().size());

        var scores = template.layout().get(1);
        assertTrue(scores.isTable());
        assertEquals(List.of("Measure", "Current", "Change"), scores.columns());
        var row = scores.content().get(0);
        assertEquals(List.of("measure", "current", "change"), List.copyOf(row.tableMap().keySet()));
        assertEquals(SlotKind.COMPUTED, row.tableMap().get("change").slot());

        var narrative = template.layout().get(3).content().get(0);
        assertEquals(SlotKind.MODEL, narrative.slot());
        assertEquals(List.of("scores.phq9", "session.excerpt"), narrative.aiDeps());
        assertEquals("clinical", narrative.styleHints().tone());
        assertTrue(narrative.isRequired());
    }

    @Test
    void readsJsonDocumentsAndAiAlias() {
        var template = TemplateLoader.parse(
            "{\"id\":\"json-note\",\"version\":\"2\",\"layout\":[{\"id\":\"body\",\"content\":"
                + "[{\"id\":\"summary\",\"slot\":\"AI\",\"outputPath\":\"summary\",\"source\":\"notes\"}]}]}"
        );
        var item = template.layout().get(0).content().get(0);
        assertEquals(SlotKind.MODEL, item.slot());
        assertEquals(List.of("notes"), item.source());
        assertNull(item.aiDeps());
        assertEquals("section", template.layout().get(0).type());
    }

    @Test
    void tableMapListUsesPositionalKeys() {
        var template = TemplateLoader.parse(String.join("\n",
            "id: list-map",
            "version: 1",
            "layout:",
            "  - id: grid",
            "    type: table",
            "    props: { columns: [A, B] }",
            "    content:",
            "      - id: row",
            "        slot: static",
            "        tableMap:",
            "          - { id: first, slot: static, text: a }",
            "          - { id: second, slot: static, text: b }"
        ));
        var row = template.layout().get(0).content().get(0);
        assertEquals(List.of("0", "1"), List.copyOf(row.tableMap().keySet()));
        assertEquals("second", row.tableMap().get("1").id());
    }

    @Test
    void unknownHintsAndConstraintsAreDropped() {
        var template = TemplateLoader.parse(String.join("\n",
            "id: hints",
            "version: 1",
            "layout:",
            "  - id: body",
            "    content:",
            "      - id: styled",
            "        slot: static",
            "        text: x",
            "        styleHints: { tone: warm, font: serif, tableCell: { bold: true, glow: 2 } }",
            "        constraints: { required: true, maxLength: 3 }"
        ));
        var item = template.layout().get(0).content().get(0);
        assertEquals(List.of("font", "tableCell.glow"), item.styleHints().droppedKeys());
        assertEquals(Boolean.TRUE, item.styleHints().tableCell().bold());
        assertEquals(List.of("maxLength"), item.constraints().droppedKeys());
        assertTrue(item.isRequired());
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(TemplateFormatException.class, () -> TemplateLoader.parse("layout: []"));
        assertThrows(TemplateFormatException.class, () -> TemplateLoader.parse("id: x\nlayout: []"));
        assertThrows(TemplateFormatException.class, () -> TemplateLoader.parse("id: x\nversion: 1\nlayout: {}"));
        var badSlot = assertThrows(
            TemplateFormatException.class,
            () -> TemplateLoader.parse("id: x\nversion: 1\nlayout:\n  - id: a\n    content:\n      - id: b\n        slot: magic")
        );
        assertEquals("template_format", badSlot.code());
        assertThrows(TemplateFormatException.class, () -> TemplateLoader.parse("id: [unclosed"));
        assertThrows(
            TemplateFormatException.class,
            () -> TemplateLoader.loadFromFile(NotegenTestSupport.resource("templates", "missing.yaml"))
        );
    }
}

package work.lcod.notegen.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lcod.notegen.shared.Severity;
import work.lcod.notegen.support.NotegenTestSupport;
import work.lcod.notegen.template.TemplateLoader;

class TemplateLinterTest {
    private static List<String> codes(TemplateLintResult result) {
        return result.issues().stream().map(TemplateLintIssue::code).collect(Collectors.toList());
    }

    @Test
    void fixtureTemplateIsClean() {
        var result = TemplateLinter.lint(NotegenTestSupport.loadProgressNote());
        assertTrue(result.ok());
        assertTrue(result.issues().isEmpty(), () -> result.issues().toString());
    }

    @Test
    void reportsModelDependencyProblems() {
        var template = TemplateLoader.parse(String.join("\n",
            "id: deps",
            "version: 1",
            "layout:",
            "  - id: body",
            "    content:",
            "      - id: none",
            "        slot: ai",
            "        outputPath: a.none",
            "      - id: empty",
            "        slot: model",
            "        outputPath: a.empty",
            "        aiDeps: []",
            "      - id: mixed",
            "        slot: model",
            "        outputPath: a.mixed",
            "        aiDeps: [scores, '', scores, 3]"
        ));
        var result = TemplateLinter.lint(template);
        assertEquals(
            List.of("ai.deps.required", "ai.deps.required", "ai.deps.empty", "ai.deps.invalid", "ai.deps.duplicate", "ai.deps.invalid"),
            codes(result)
        );
        var duplicate = result.issues().get(4);
        assertEquals(Severity.WARNING, duplicate.severity());
        assertEquals("mixed", duplicate.slotId());
        assertEquals("body", duplicate.componentId());
        assertEquals("aiDeps[1] must be a non-empty string path.", result.issues().get(3).message());
    }

    @Test
    void reportsTableShapeProblems() {
        var template = TemplateLoader.parse(String.join("\n",
            "id: tables",
            "version: 1",
            "layout:",
            "  - id: outer",
            "    children:",
            "      - id: grid",
            "        type: table",
            "        props:",
            "          columns: [A, B]",
            "          colWidths: [50]",
            "        content:",
            "          - id: row",
            "            slot: static",
            "            tableMap:",
            "              - id: a",
            "                slot: static",
            "                targetPath: grid.a",
            "                text: x",
            "                styleHints:",
            "                  tableCell:",
            "                    columnIndex: 4",
            "  - id: empty-grid",
            "    type: table"
        ));
        var result = TemplateLinter.lint(template);
        assertEquals(
            List.of("table.colWidths.mismatch", "table.map.length", "styleHint.tableCell.columnIndex.range", "table.columns.required"),
            codes(result)
        );
        assertEquals("outer.grid", result.issues().get(0).path());
        assertEquals("tableMap column count (1) must match props.columns length (2).", result.issues().get(1).message());
    }

    @Test
    void reportsUnknownKeysAndInvalidPaths() {
        var template = TemplateLoader.parse(String.join("\n",
            "id: keys",
            "version: 1",
            "layout:",
            "  - id: body",
            "    content:",
            "      - id: styled",
            "        slot: static",
            "        targetPath: 'bad..path'",
            "        text: x",
            "        styleHints:",
            "          color: red",
            "          tableCell:",
            "            columnIndex: first",
            "        constraints:",
            "          maxLength: 10"
        ));
        var result = TemplateLinter.lint(template);
        assertEquals(
            List.of("path.invalid", "styleHint.unknown", "styleHint.tableCell.columnIndex.type", "constraint.unknown"),
            codes(result)
        );
        assertEquals(2, result.errors().size());
        assertEquals(2, result.warnings().size());
    }
}

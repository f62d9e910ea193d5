package work.lcod.notegen.composition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.notegen.schema.DerivedSchema;
import work.lcod.notegen.schema.SchemaDeriver;
import work.lcod.notegen.support.NotegenTestSupport;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.PromptConfig;

class PromptComposerTest {
    private static final Map<String, Object> SNAPSHOT = Map.of(
        "header", Map.of("clinic", "Riverside Clinic"),
        "scores", Map.of("phq9", Map.of("current", 8, "change", "-4")),
        "session", Map.of(
            "excerpt", Map.of("text", "I have been sleeping better.", "ref", "transcripts:s1#t=0-10"),
            "dx", List.of(Map.of("code", "F32.1"))
        )
    );

    private NoteTemplate template;
    private DerivedSchema modelSchema;
    private PromptComposer composer;

    @BeforeEach
    void setUp() {
        template = NotegenTestSupport.loadProgressNote();
        modelSchema = SchemaDeriver.modelFields().derive(template);
        composer = new PromptComposer(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void composesBundleWithFactPack() {
        var result = composer.compose(new CompositionInput(template, modelSchema, SNAPSHOT, Map.of("risk", Map.of("level", "low"))));
        var bundle = result.bundle();

        assertEquals("progress-note@1.0.0_2024-01-01T00:00:00Z", bundle.id());
        assertEquals("progress-note", bundle.templateId());
        assertEquals("1.0.0", bundle.templateVersion());
        assertEquals(3, bundle.fieldGuide().size());
        assertEquals(List.of("scores", "session"), List.copyOf(bundle.context().nasSlices().keySet()));
        assertTrue(result.lint().ok(), () -> result.lint().issues().toString());
        assertTrue(result.lint().warnings().isEmpty(), () -> result.lint().warnings().toString());
        assertTrue(result.issues().isEmpty());
        assertFalse(result.hasErrors());
    }

    @Test
    void rendersSystemAndUserMessages() {
        var bundle = composer.compose(new CompositionInput(template, modelSchema, SNAPSHOT, Map.of("risk", "low"))).bundle();
        assertEquals(2, bundle.messages().size());

        var system = bundle.messages().get(0);
        assertEquals(MessageRole.SYSTEM, system.role());
        assertTrue(system.content().startsWith("You are a clinical documentation assistant.\n\nCRITICAL CONSTRAINTS:\n"));
        assertTrue(system.content().contains("- Return ONLY JSON that conforms to the provided JSON Schema."));

        var user = bundle.messages().get(1).content();
        assertEquals(MessageRole.USER, bundle.messages().get(1).role());
        assertTrue(user.startsWith("PURPOSE\nWrite the assessment and plan sections"));
        assertTrue(user.contains("HARD RULES\n- Write in the third person.\n"));
        assertTrue(user.contains("RESPONSE CONTRACT\nReturn a single JSON object that EXACTLY matches the provided JSON Schema."));
        assertTrue(user.contains("FACT PACK:"));
        assertTrue(user.contains("NON-MODEL SNAPSHOT (sliced):"));
        assertTrue(user.contains("- path: assessment.risk\n  description: Overall risk level.\n  deps:\n    - source.risk.level"));
        assertTrue(user.contains("  constraints: {\"enum\":[\"low\",\"moderate\",\"high\"]}"));
        assertTrue(user.contains("  style: {\"tone\":\"clinical\"}"));
        assertTrue(user.indexOf("CONTEXT") < user.indexOf("FIELD GUIDE"));
        assertFalse(user.contains("\"header\""));
    }

    @Test
    void snapshotContextIsCanonical() {
        var user = composer.compose(new CompositionInput(template, modelSchema, SNAPSHOT, null)).bundle().messages().get(1).content();
        assertFalse(user.contains("FACT PACK:"));
        assertTrue(user.indexOf("\"change\"") < user.indexOf("\"current\""));
        assertTrue(user.indexOf("\"dx\"") < user.indexOf("\"excerpt\""));
    }

    @Test
    void omitsHardRulesWhenTemplateHasNone() {
        var plain = template.withPrompt(new PromptConfig(null, null, List.of()));
        var bundle = composer.compose(new CompositionInput(plain, modelSchema, SNAPSHOT, null)).bundle();
        assertTrue(bundle.messages().get(0).content().startsWith("CRITICAL CONSTRAINTS:"));
        assertFalse(bundle.messages().get(1).content().contains("HARD RULES"));
    }

    @Test
    void emptySnapshotReportsWithoutThrowing() {
        var result = composer.compose(new CompositionInput(template, modelSchema, Map.of(), null));
        assertTrue(result.lint().errors().isEmpty());
        assertFalse(result.lint().warnings().isEmpty());
        assertTrue(result.issues().stream().anyMatch(issue -> "context-slice.empty".equals(issue.check())));
        assertTrue(result.lint().issues().stream().noneMatch(issue -> "context-slice.empty".equals(issue.check())));
        assertTrue(result.hasErrors());
    }

    @Test
    void bundleSerializesToMap() {
        var map = composer.compose(new CompositionInput(template, modelSchema, SNAPSHOT, null)).bundle().toMap();
        assertEquals(List.of("id", "templateId", "templateVersion", "messages", "jsonSchema", "fieldGuide", "context"),
            List.copyOf(map.keySet()));
        assertEquals(modelSchema.toJson(), map.get("jsonSchema"));
    }
}

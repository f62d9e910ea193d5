package work.lcod.notegen.composition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import work.lcod.notegen.schema.DerivedSchema;
import work.lcod.notegen.schema.SchemaDeriver;
import work.lcod.notegen.support.NotegenTestSupport;
import work.lcod.notegen.template.NoteTemplate;

class PromptLinterTest {
    private NoteTemplate template;
    private DerivedSchema modelSchema;
    private PromptBundle bundle;

    @BeforeEach
    void setUp() {
        template = NotegenTestSupport.loadProgressNote();
        modelSchema = SchemaDeriver.modelFields().derive(template);
        var snapshot = Map.<String, Object>of(
            "scores", Map.of("phq9", Map.of("current", 8)),
            "session", Map.of("excerpt", Map.of("text", "t", "ref", "r"), "dx", List.of("F32.1"))
        );
        bundle = new PromptComposer(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC))
            .compose(new CompositionInput(template, modelSchema, snapshot, Map.of("risk", Map.of("level", "low"))))
            .bundle();
    }

    private static PromptBundle withGuide(PromptBundle source, List<FieldGuideEntry> guide) {
        return new PromptBundle(source.id(), source.templateId(), source.templateVersion(), source.messages(),
            source.jsonSchema(), guide, source.context());
    }

    private static PromptBundle withMessages(PromptBundle source, List<Message> messages) {
        return new PromptBundle(source.id(), source.templateId(), source.templateVersion(), messages,
            source.jsonSchema(), source.fieldGuide(), source.context());
    }

    private static List<String> checks(LintResult result) {
        return result.issues().stream().map(LintIssue::check).collect(Collectors.toList());
    }

    @Test
    void cleanBundlePasses() {
        var result = PromptLinter.lint(bundle, modelSchema, template);
        assertTrue(result.ok());
        assertTrue(result.issues().isEmpty(), () -> result.issues().toString());
    }

    @Test
    void coverageMismatchIsError() {
        var result = PromptLinter.lint(withGuide(bundle, bundle.fieldGuide().subList(0, 2)), modelSchema, template);
        assertFalse(result.ok());
        assertEquals("Field guide has 2 entries but template has 3 model items", result.errors().get(0).message());
    }

    @Test
    void unknownPathIsError() {
        var guide = new ArrayList<>(bundle.fieldGuide().subList(0, 2));
        guide.add(new FieldGuideEntry("plan.missing", null, List.of(), List.of(FieldDependency.of("scores")), null, null));
        var result = PromptLinter.lint(withGuide(bundle, guide), modelSchema, template);
        assertEquals(List.of("path-validity"), checks(result));
        assertTrue(result.errors().get(0).message().endsWith("plan.missing"));
    }

    @Test
    void constraintDisagreementIsWarning() {
        var risk = bundle.fieldGuide().get(1);
        var changed = new FieldGuideEntry(risk.path(), risk.description(), risk.guidance(), risk.dependencies(),
            new FieldConstraints(List.of("low", "high"), "^[a-z]+$", null, null, null, null), risk.style());
        var guide = List.of(bundle.fieldGuide().get(0), changed, bundle.fieldGuide().get(2));
        var result = PromptLinter.lint(withGuide(bundle, guide), modelSchema, template);
        assertTrue(result.ok());
        assertEquals(List.of("constraint-harmony", "constraint-harmony"), checks(result));
        assertTrue(result.warnings().get(0).message().startsWith("Pattern mismatch at assessment.risk"));
        assertEquals("Enum mismatch at assessment.risk", result.warnings().get(1).message());
    }

    @Test
    void unresolvableDependenciesAreWarnings() {
        var context = new PromptContext(null, Map.of());
        var stripped = new PromptBundle(bundle.id(), bundle.templateId(), bundle.templateVersion(), bundle.messages(),
            bundle.jsonSchema(), bundle.fieldGuide(), context);
        var result = PromptLinter.lint(stripped, modelSchema, template);
        assertTrue(result.ok());
        assertEquals(4, result.warnings().size());
        assertTrue(result.warnings().stream().anyMatch(issue ->
            issue.message().equals("Dependency not present in context (source): source.risk.level (required by assessment.risk)")));
    }

    @Test
    void entryWithoutDependenciesIsError() {
        var narrative = bundle.fieldGuide().get(0);
        var bare = new FieldGuideEntry(narrative.path(), null, List.of(), List.of(), null, null);
        var guide = List.of(bare, bundle.fieldGuide().get(1), bundle.fieldGuide().get(2));
        var result = PromptLinter.lint(withGuide(bundle, guide), modelSchema, template);
        assertEquals(List.of("dependencies"), checks(result));
        assertFalse(result.ok());
    }

    @Test
    void messageRolesAreChecked() {
        var messages = bundle.messages();
        var swapped = PromptLinter.lint(withMessages(bundle, List.of(messages.get(1), messages.get(0))), modelSchema, template);
        assertTrue(checks(swapped).contains("message-roles"));
        assertEquals("First message must be system role, got: user", swapped.errors().get(0).message());

        var single = PromptLinter.lint(withMessages(bundle, List.of(messages.get(0))), modelSchema, template);
        assertEquals("Bundle must have at least 2 messages (system and user)", single.errors().get(0).message());
    }

    @Test
    void missingResponseContractIsError() {
        var messages = List.of(bundle.messages().get(0), new Message(MessageRole.USER, "PURPOSE\nWrite things."));
        var result = PromptLinter.lint(withMessages(bundle, messages), modelSchema, template);
        assertEquals(List.of("response-contract"), checks(result));
    }
}

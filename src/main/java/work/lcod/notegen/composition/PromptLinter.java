package work.lcod.notegen.composition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import work.lcod.notegen.path.InvalidPathException;
import work.lcod.notegen.path.PathReader;
import work.lcod.notegen.schema.ArraySchema;
import work.lcod.notegen.schema.DerivedSchema;
import work.lcod.notegen.schema.SchemaNode;
import work.lcod.notegen.schema.StringSchema;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.TemplateWalker;

/**
 * Consistency checks between a prompt bundle, the model schema and the template. Problems are
 * reported, never thrown.
 */
public final class PromptLinter {
    private PromptLinter() {}

    public static LintResult lint(PromptBundle bundle, DerivedSchema modelSchema, NoteTemplate template) {
        var issues = new ArrayList<LintIssue>();
        checkCoverage(bundle, template, issues);
        checkPaths(bundle, modelSchema, issues);
        checkConstraintHarmony(bundle, modelSchema, issues);
        checkDependencies(bundle, issues);
        checkMessageRoles(bundle, issues);
        checkResponseContract(bundle, issues);
        return LintResult.of(issues);
    }

    private static void checkCoverage(PromptBundle bundle, NoteTemplate template, List<LintIssue> issues) {
        int expected = TemplateWalker.countModelLeaves(template);
        int actual = bundle.fieldGuide().size();
        if (expected != actual) {
            issues.add(LintIssue.error(
                "coverage",
                "Field guide has " + actual + " entries but template has " + expected + " model items",
                null
            ));
        }
    }

    private static void checkPaths(PromptBundle bundle, DerivedSchema schema, List<LintIssue> issues) {
        for (var entry : bundle.fieldGuide()) {
            if (schema.nodeAt(entry.path()) == null) {
                issues.add(LintIssue.error("path-validity", "Field guide path not in model schema: " + entry.path(), entry.path()));
            }
        }
    }

    private static void checkConstraintHarmony(PromptBundle bundle, DerivedSchema schema, List<LintIssue> issues) {
        for (var entry : bundle.fieldGuide()) {
            var constraints = entry.constraints();
            var node = leafString(schema.nodeAt(entry.path()));
            if (constraints == null || node == null) {
                continue;
            }
            if (constraints.pattern() != null && !constraints.pattern().equals(node.pattern())) {
                issues.add(LintIssue.warning(
                    "constraint-harmony",
                    "Pattern mismatch at " + entry.path() + ": field guide has \"" + constraints.pattern()
                        + "\", model schema has \"" + node.pattern() + "\"",
                    entry.path()
                ));
            }
            if (constraints.enumValues() != null && !sameSet(constraints.enumValues(), node.enumValues())) {
                issues.add(LintIssue.warning("constraint-harmony", "Enum mismatch at " + entry.path(), entry.path()));
            }
        }
    }

    private static void checkDependencies(PromptBundle bundle, List<LintIssue> issues) {
        var context = bundle.context();
        for (var entry : bundle.fieldGuide()) {
            if (entry.dependencies().isEmpty()) {
                issues.add(LintIssue.error(
                    "dependencies",
                    "Model field " + entry.path() + " is missing dependency metadata.",
                    entry.path()
                ));
                continue;
            }
            for (var dependency : entry.dependencies()) {
                boolean present = dependency.scope() == DependencyScope.SOURCE
                    ? context.factPack() != null && readable(context.factPack(), dependency.factPackPath())
                    : readable(context.nasSlices(), dependency.path());
                if (!present) {
                    issues.add(LintIssue.warning(
                        "dependencies",
                        "Dependency not present in context (" + dependency.scope().wireName() + "): "
                            + dependency.path() + " (required by " + entry.path() + ")",
                        entry.path()
                    ));
                }
            }
        }
    }

    private static void checkMessageRoles(PromptBundle bundle, List<LintIssue> issues) {
        var messages = bundle.messages();
        if (messages.size() < 2) {
            issues.add(LintIssue.error("message-roles", "Bundle must have at least 2 messages (system and user)", null));
            return;
        }
        if (messages.get(0).role() != MessageRole.SYSTEM) {
            issues.add(LintIssue.error(
                "message-roles",
                "First message must be system role, got: " + messages.get(0).role().wireName(),
                null
            ));
        }
        if (messages.get(1).role() != MessageRole.USER) {
            issues.add(LintIssue.error("message-roles", "Second message must be user role", null));
        }
    }

    private static void checkResponseContract(PromptBundle bundle, List<LintIssue> issues) {
        var user = bundle.messages().stream()
            .filter(message -> message.role() == MessageRole.USER)
            .findFirst();
        if (user.isEmpty() || !user.get().content().contains("Return a single JSON object")) {
            issues.add(LintIssue.error(
                "response-contract",
                "User message must include the JSON response contract directive.",
                null
            ));
        }
    }

    private static boolean readable(Object root, String path) {
        try {
            return PathReader.exists(root, path);
        } catch (InvalidPathException ex) {
            return false;
        }
    }

    private static StringSchema leafString(SchemaNode node) {
        var current = node;
        while (current instanceof ArraySchema array) {
            current = array.items();
        }
        return current instanceof StringSchema string ? string : null;
    }

    private static boolean sameSet(List<String> left, List<String> right) {
        if (right == null) {
            return false;
        }
        return Objects.equals(new HashSet<>(left), new HashSet<>(right));
    }
}

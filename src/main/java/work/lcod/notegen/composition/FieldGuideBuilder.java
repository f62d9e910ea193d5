package work.lcod.notegen.composition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.TemplateWalker;

/**
 * Collects one guide entry per model leaf, in layout order.
 */
public final class FieldGuideBuilder {
    private FieldGuideBuilder() {}

    public static FieldGuide build(NoteTemplate template) {
        var entries = new ArrayList<FieldGuideEntry>();
        var issues = new ArrayList<LintIssue>();
        TemplateWalker.walk(template, (component, item) -> {
            if (item.slot().isModel() && item.outputPath() != null) {
                entries.add(entryFor(item, issues));
            }
        });
        return new FieldGuide(entries, issues);
    }

    private static FieldGuideEntry entryFor(ContentItem item, List<LintIssue> issues) {
        var path = item.outputPath();
        var dependencies = dependenciesOf(item);
        if (dependencies.isEmpty()) {
            issues.add(LintIssue.error(
                "field-guide.dependencies",
                "Model field " + path + " (" + item.id() + ") declares no aiDeps or source dependencies.",
                path
            ));
        }
        var styleHints = item.styleHints();
        if (styleHints != null) {
            for (var key : styleHints.droppedKeys()) {
                issues.add(LintIssue.warning(
                    "field-guide.style",
                    "Dropped unsupported style hint '" + key + "' on " + path + ".",
                    path
                ));
            }
        }
        return new FieldGuideEntry(
            path,
            item.description(),
            item.guidance(),
            dependencies,
            FieldConstraints.from(item.constraints()),
            styleHints == null ? null : styleHints.toMap()
        );
    }

    private static List<FieldDependency> dependenciesOf(ContentItem item) {
        var declared = nonBlank(item.aiDeps());
        var raw = declared.isEmpty() ? nonBlank(item.source()) : declared;
        var unique = new LinkedHashSet<FieldDependency>();
        for (var path : raw) {
            unique.add(FieldDependency.of(path));
        }
        return new ArrayList<>(unique);
    }

    private static List<String> nonBlank(List<String> values) {
        var out = new ArrayList<String>();
        if (values != null) {
            for (var value : values) {
                if (value != null && !value.isBlank()) {
                    out.add(value.trim());
                }
            }
        }
        return out;
    }
}

package work.lcod.notegen.validation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import work.lcod.notegen.path.PathParser;
import work.lcod.notegen.shared.Severity;
import work.lcod.notegen.template.Component;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.StyleHints;

/**
 * Authoring checks run before derivation: model dependency metadata, style hints, constraint keys,
 * table shape and path syntax.
 */
public final class TemplateLinter {
    private TemplateLinter() {}

    public static TemplateLintResult lint(NoteTemplate template) {
        var issues = new ArrayList<TemplateLintIssue>();
        for (var component : template.layout()) {
            visitComponent(component, "", issues);
        }
        return TemplateLintResult.of(issues);
    }

    private static void visitComponent(Component component, String parentPath, List<TemplateLintIssue> issues) {
        var scope = new Scope(component, parentPath.isEmpty() ? component.id() : parentPath + "." + component.id(), issues);
        if (component.isTable()) {
            lintTable(component, scope);
        }
        for (var item : component.content()) {
            lintItem(item, scope);
        }
        for (var child : component.children()) {
            visitComponent(child, scope.path, issues);
        }
    }

    private static void lintTable(Component component, Scope scope) {
        var columns = component.columns();
        if (columns == null || columns.isEmpty()) {
            scope.error("table.columns.required", "Table components must declare at least one column in props.columns.", null);
        }
        var colWidths = component.colWidths();
        if (columns != null && colWidths != null && colWidths.size() != columns.size()) {
            scope.error(
                "table.colWidths.mismatch",
                "colWidths length (" + colWidths.size() + ") must match columns length (" + columns.size() + ").",
                null
            );
        }
        scope.columns = columns;
    }

    private static void lintItem(ContentItem item, Scope scope) {
        if (item.slot().isModel()) {
            lintModelDependencies(item, scope);
        }
        lintPath(item, scope);
        if (item.styleHints() != null) {
            lintStyleHints(item.styleHints(), item.id(), scope);
        }
        for (var key : item.constraints().droppedKeys()) {
            scope.warning(
                "constraint.unknown",
                "Constraint '" + key + "' is not supported and was ignored.",
                item.id()
            );
        }
        for (var nested : item.listItems()) {
            lintItem(nested, scope);
        }
        if (!item.tableMap().isEmpty()) {
            if (scope.columns != null && item.tableMap().size() != scope.columns.size()) {
                scope.error(
                    "table.map.length",
                    "tableMap column count (" + item.tableMap().size() + ") must match props.columns length ("
                        + scope.columns.size() + ").",
                    scope.component.id()
                );
            }
            for (var cell : item.tableMap().values()) {
                lintItem(cell, scope);
            }
        }
    }

    private static void lintModelDependencies(ContentItem item, Scope scope) {
        var deps = item.aiDeps();
        boolean hasSource = !item.source().isEmpty();
        boolean hasDeps = deps != null && deps.stream().anyMatch(dep -> dep != null && !dep.isEmpty());
        if (!hasSource && !hasDeps) {
            scope.error("ai.deps.required", "Model content must specify aiDeps when no source data is declared.", item.id());
        }
        if (deps == null) {
            return;
        }
        if (deps.isEmpty()) {
            scope.error("ai.deps.empty", "aiDeps array must include at least one dependency path.", item.id());
        }
        var seen = new HashSet<String>();
        for (int i = 0; i < deps.size(); i++) {
            var dep = deps.get(i);
            if (dep == null || dep.isBlank()) {
                scope.error("ai.deps.invalid", "aiDeps[" + i + "] must be a non-empty string path.", item.id());
                continue;
            }
            var trimmed = dep.trim();
            if (!seen.add(trimmed)) {
                scope.warning("ai.deps.duplicate", "Duplicate dependency '" + trimmed + "' found in aiDeps.", item.id());
            }
        }
    }

    private static void lintPath(ContentItem item, Scope scope) {
        var path = item.declaredPath();
        if (path != null && !PathParser.isValid(path)) {
            scope.error("path.invalid", "Path '" + path + "' is not a valid dotted path.", item.id());
        }
    }

    private static void lintStyleHints(StyleHints hints, String slotId, Scope scope) {
        for (var key : hints.droppedKeys()) {
            scope.warning(
                "styleHint.unknown",
                "Style hint '" + key + "' is not recognised; update documentation or remove the hint if unintended.",
                slotId
            );
        }
        var cell = hints.tableCell();
        if (cell == null) {
            return;
        }
        if (cell.invalidKeys().contains("columnIndex")) {
            scope.error("styleHint.tableCell.columnIndex.type", "tableCell.columnIndex must be an integer column position.", slotId);
        } else if (cell.columnIndex() != null && scope.columns != null
            && (cell.columnIndex() < 0 || cell.columnIndex() >= scope.columns.size())) {
            scope.error(
                "styleHint.tableCell.columnIndex.range",
                "tableCell.columnIndex " + cell.columnIndex() + " is outside the configured column range (0-"
                    + (scope.columns.size() - 1) + ").",
                slotId
            );
        }
    }

    private static final class Scope {
        private final Component component;
        private final String path;
        private final List<TemplateLintIssue> issues;
        private List<String> columns;

        private Scope(Component component, String path, List<TemplateLintIssue> issues) {
            this.component = component;
            this.path = path;
            this.issues = issues;
        }

        private void error(String code, String message, String slotId) {
            issues.add(new TemplateLintIssue(code, message, Severity.ERROR, component.id(), path, slotId));
        }

        private void warning(String code, String message, String slotId) {
            issues.add(new TemplateLintIssue(code, message, Severity.WARNING, component.id(), path, slotId));
        }
    }
}

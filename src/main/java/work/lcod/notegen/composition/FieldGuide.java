package work.lcod.notegen.composition;

import java.util.List;

public record FieldGuide(List<FieldGuideEntry> entries, List<LintIssue> issues) {
    public FieldGuide {
        entries = List.copyOf(entries);
        issues = List.copyOf(issues);
    }
}

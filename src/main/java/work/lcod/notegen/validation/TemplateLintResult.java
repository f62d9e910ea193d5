package work.lcod.notegen.validation;

import java.util.List;
import java.util.stream.Collectors;

public record TemplateLintResult(List<TemplateLintIssue> issues, List<TemplateLintIssue> errors, List<TemplateLintIssue> warnings) {
    public TemplateLintResult {
        issues = List.copyOf(issues);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static TemplateLintResult of(List<TemplateLintIssue> issues) {
        return new TemplateLintResult(
            issues,
            issues.stream().filter(TemplateLintIssue::isError).collect(Collectors.toList()),
            issues.stream().filter(issue -> !issue.isError()).collect(Collectors.toList())
        );
    }

    public boolean ok() {
        return errors.isEmpty();
    }
}

package work.lcod.notegen.composition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record LintResult(boolean ok, List<LintIssue> issues, List<LintIssue> errors, List<LintIssue> warnings) {
    public LintResult {
        issues = List.copyOf(issues);
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static LintResult of(List<LintIssue> issues) {
        var errors = issues.stream().filter(LintIssue::isError).collect(Collectors.toList());
        var warnings = issues.stream().filter(issue -> !issue.isError()).collect(Collectors.toList());
        return new LintResult(errors.isEmpty(), issues, errors, warnings);
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("ok", ok);
        out.put("errors", errors.stream().map(LintIssue::toMap).collect(Collectors.toList()));
        out.put("warnings", warnings.stream().map(LintIssue::toMap).collect(Collectors.toList()));
        return out;
    }
}

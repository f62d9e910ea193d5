package work.lcod.notegen.composition;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.notegen.shared.Severity;

/**
 * Diagnostic from prompt composition or linting. {@code check} names the rule, e.g. {@code coverage}.
 */
public record LintIssue(Severity severity, String check, String message, String path) {
    public static LintIssue error(String check, String message, String path) {
        return new LintIssue(Severity.ERROR, check, message, path);
    }

    public static LintIssue warning(String check, String message, String path) {
        return new LintIssue(Severity.WARNING, check, message, path);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("severity", severity.wireName());
        out.put("check", check);
        out.put("message", message);
        if (path != null) {
            out.put("path", path);
        }
        return out;
    }
}

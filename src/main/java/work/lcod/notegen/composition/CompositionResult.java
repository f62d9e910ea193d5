package work.lcod.notegen.composition;

import java.util.List;

/**
 * Bundle plus diagnostics. {@code issues} holds field-guide and slicing problems, {@code lint} the bundle checks.
 */
public record CompositionResult(PromptBundle bundle, LintResult lint, List<LintIssue> issues) {
    public CompositionResult {
        issues = List.copyOf(issues);
    }

    public boolean hasErrors() {
        return !lint.ok() || issues.stream().anyMatch(LintIssue::isError);
    }
}

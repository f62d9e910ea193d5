package work.lcod.notegen.composition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ContextSlice(Map<String, Object> nasSlices, List<LintIssue> issues) {
    public ContextSlice {
        nasSlices = Collections.unmodifiableMap(new LinkedHashMap<>(nasSlices));
        issues = List.copyOf(issues);
    }

    public boolean isEmpty() {
        return nasSlices.isEmpty();
    }
}

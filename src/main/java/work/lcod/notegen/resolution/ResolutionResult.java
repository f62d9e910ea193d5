package work.lcod.notegen.resolution;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Snapshot of every resolved non-model value plus the per-field records and warnings.
 */
public record ResolutionResult(Map<String, Object> snapshot, List<ResolvedField> resolved, List<ResolutionWarning> warnings) {
    public ResolutionResult {
        resolved = List.copyOf(resolved);
        warnings = List.copyOf(warnings);
    }

    public boolean hasErrors() {
        return warnings.stream().anyMatch(ResolutionWarning::isError);
    }

    public List<ResolutionWarning> errors() {
        return warnings.stream().filter(ResolutionWarning::isError).collect(Collectors.toList());
    }
}

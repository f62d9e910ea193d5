package work.lcod.notegen.formula;

import java.util.List;
import java.util.Map;
import work.lcod.notegen.path.PathReader;
import work.lcod.notegen.path.PathSegment;

/**
 * Resolves path references used inside a formula; {@code null} means the path does not exist.
 */
@FunctionalInterface
public interface FormulaScope {
    Object resolve(List<PathSegment> path);

    static FormulaScope of(Map<String, Object> data) {
        return path -> data == null ? null : PathReader.read(data, path).orElse(null);
    }

    /**
     * Looks in {@code primary} first and falls back to {@code fallback}.
     */
    static FormulaScope layered(Map<String, Object> primary, Map<String, Object> fallback) {
        var first = of(primary);
        var second = of(fallback);
        return path -> {
            var value = first.resolve(path);
            return value != null ? value : second.resolve(path);
        };
    }
}

package work.lcod.notegen.composition;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record FieldDependency(String path, DependencyScope scope) {
    public FieldDependency {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(scope, "scope");
    }

    public static FieldDependency of(String path) {
        return new FieldDependency(path, DependencyScope.classify(path));
    }

    /**
     * Path to look up inside the fact pack: the leading {@code source.} segment is dropped.
     */
    public String factPackPath() {
        if (scope == DependencyScope.SOURCE && path.startsWith("source.")) {
            return path.substring("source.".length());
        }
        return path;
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("path", path);
        out.put("scope", scope.wireName());
        return out;
    }
}

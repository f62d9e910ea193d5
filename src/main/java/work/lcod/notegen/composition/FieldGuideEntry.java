package work.lcod.notegen.composition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Instructions for one model-produced field. {@code constraints} and {@code style} are null when absent.
 */
public record FieldGuideEntry(
    String path,
    String description,
    List<String> guidance,
    List<FieldDependency> dependencies,
    FieldConstraints constraints,
    Map<String, Object> style
) {
    public FieldGuideEntry {
        Objects.requireNonNull(path, "path");
        guidance = guidance == null ? List.of() : List.copyOf(guidance);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        style = style == null || style.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(style));
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("path", path);
        if (description != null) {
            out.put("description", description);
        }
        if (!guidance.isEmpty()) {
            out.put("guidance", guidance);
        }
        out.put("dependencies", dependencies.stream().map(FieldDependency::toMap).collect(Collectors.toList()));
        if (constraints != null) {
            out.put("constraints", constraints.toMap());
        }
        if (style != null) {
            out.put("style", style);
        }
        return out;
    }
}

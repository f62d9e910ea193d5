package work.lcod.notegen.resolution;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import work.lcod.notegen.schema.DerivedSchema;
import work.lcod.notegen.template.NoteTemplate;

/**
 * What a resolver can see: the template, the caller's source data, the target schema and a
 * read-only view of the snapshot written so far.
 */
public record ResolutionContext(
    NoteTemplate template,
    Map<String, Object> sourceData,
    DerivedSchema targetSchema,
    Map<String, Object> partialSnapshot
) {
    public ResolutionContext {
        Objects.requireNonNull(template, "template");
        sourceData = sourceData == null ? Map.of() : sourceData;
        partialSnapshot = partialSnapshot == null ? Map.of() : Collections.unmodifiableMap(partialSnapshot);
    }
}

package work.lcod.notegen.composition;

import java.util.Map;
import java.util.Objects;
import work.lcod.notegen.schema.DerivedSchema;
import work.lcod.notegen.template.NoteTemplate;

/**
 * Inputs of {@link PromptComposer#compose}. {@code factPack} is optional.
 */
public record CompositionInput(
    NoteTemplate template,
    DerivedSchema modelSchema,
    Map<String, Object> snapshot,
    Map<String, Object> factPack
) {
    public CompositionInput {
        Objects.requireNonNull(template, "template");
        Objects.requireNonNull(modelSchema, "modelSchema");
        snapshot = snapshot == null ? Map.of() : snapshot;
    }
}

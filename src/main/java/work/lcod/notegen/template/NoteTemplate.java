package work.lcod.notegen.template;

import java.util.List;
import java.util.Objects;

/**
 * Declarative note template: identity, authored prompt text and the component layout.
 */
public record NoteTemplate(
    String id,
    String name,
    String version,
    String description,
    PromptConfig prompt,
    List<Component> layout
) {
    public NoteTemplate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
        name = name == null ? id : name;
        prompt = prompt == null ? PromptConfig.empty() : prompt;
        layout = layout == null ? List.of() : List.copyOf(layout);
    }

    public static NoteTemplate of(String id, String version, List<Component> layout) {
        return new NoteTemplate(id, id, version, null, PromptConfig.empty(), layout);
    }

    public NoteTemplate withPrompt(PromptConfig newPrompt) {
        return new NoteTemplate(id, name, version, description, newPrompt, layout);
    }
}

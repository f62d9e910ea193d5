package work.lcod.notegen.composition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import work.lcod.notegen.shared.CanonicalJson;
import work.lcod.notegen.template.NoteTemplate;

/**
 * Renders the system and user messages of a prompt bundle.
 */
public final class MessageBuilder {
    static final String CONTRACT_DIRECTIVE = "Return a single JSON object that EXACTLY matches the provided JSON Schema.";
    static final String SNAPSHOT_LABEL = "NON-MODEL SNAPSHOT (sliced):";

    private static final List<String> CRITICAL_CONSTRAINTS = List.of(
        "- Return ONLY JSON that conforms to the provided JSON Schema.",
        "- Do not invent facts beyond supplied context.",
        "- Prefer data already present in the non-model snapshot for derived values; only compose requested model fields."
    );

    private MessageBuilder() {}

    public static List<Message> build(
        NoteTemplate template,
        List<FieldGuideEntry> entries,
        Map<String, Object> factPack,
        Map<String, Object> nasSlices
    ) {
        return List.of(
            new Message(MessageRole.SYSTEM, systemMessage(template)),
            new Message(MessageRole.USER, userMessage(template, entries, factPack, nasSlices))
        );
    }

    static String systemMessage(NoteTemplate template) {
        var lines = new ArrayList<String>();
        var system = template.prompt().system();
        if (system != null && !system.isBlank()) {
            lines.add(system.trim());
            lines.add("");
        }
        lines.add("CRITICAL CONSTRAINTS:");
        lines.addAll(CRITICAL_CONSTRAINTS);
        return String.join("\n", lines);
    }

    static String userMessage(
        NoteTemplate template,
        List<FieldGuideEntry> entries,
        Map<String, Object> factPack,
        Map<String, Object> nasSlices
    ) {
        var prompt = template.prompt();
        var lines = new ArrayList<String>();
        lines.add("PURPOSE");
        lines.add(prompt.main() == null || prompt.main().isBlank()
            ? "Compose the model-authored fields of the " + template.name() + " note."
            : prompt.main().trim());
        lines.add("");

        if (!prompt.rules().isEmpty()) {
            lines.add("HARD RULES");
            for (var rule : prompt.rules()) {
                lines.add("- " + rule);
            }
            lines.add("");
        }

        lines.add("RESPONSE CONTRACT");
        lines.add(CONTRACT_DIRECTIVE);
        lines.add("");

        lines.add("CONTEXT");
        if (factPack != null) {
            lines.add("FACT PACK:");
            lines.add(CanonicalJson.canonical(factPack));
            lines.add("");
        }
        lines.add(SNAPSHOT_LABEL);
        lines.add(CanonicalJson.canonical(nasSlices == null ? Map.of() : nasSlices));
        lines.add("");

        lines.add("FIELD GUIDE");
        for (var entry : entries) {
            appendEntry(lines, entry);
        }
        return String.join("\n", lines);
    }

    private static void appendEntry(List<String> lines, FieldGuideEntry entry) {
        lines.add("- path: " + entry.path());
        if (entry.description() != null && !entry.description().isBlank()) {
            lines.add("  description: " + entry.description());
        }
        if (!entry.guidance().isEmpty()) {
            lines.add("  guidance:");
            for (var item : entry.guidance()) {
                lines.add("    - " + item);
            }
        }
        if (!entry.dependencies().isEmpty()) {
            lines.add("  deps:");
            for (var dependency : entry.dependencies()) {
                lines.add("    - " + dependency.path());
            }
        }
        if (entry.constraints() != null) {
            lines.add("  constraints: " + CanonicalJson.compact(entry.constraints().toMap()));
        }
        if (entry.style() != null) {
            lines.add("  style: " + CanonicalJson.compact(entry.style()));
        }
    }
}

package work.lcod.notegen.composition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import work.lcod.notegen.schema.DerivedSchema;

/**
 * Everything needed to call a model once: messages, the output schema, the field guide and context.
 */
public record PromptBundle(
    String id,
    String templateId,
    String templateVersion,
    List<Message> messages,
    DerivedSchema jsonSchema,
    List<FieldGuideEntry> fieldGuide,
    PromptContext context
) {
    public PromptBundle {
        messages = List.copyOf(messages);
        fieldGuide = List.copyOf(fieldGuide);
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("id", id);
        out.put("templateId", templateId);
        out.put("templateVersion", templateVersion);
        out.put("messages", messages.stream().map(Message::toMap).collect(Collectors.toList()));
        out.put("jsonSchema", jsonSchema.toJson());
        out.put("fieldGuide", fieldGuide.stream().map(FieldGuideEntry::toMap).collect(Collectors.toList()));
        out.put("context", context.toMap());
        return out;
    }
}

package work.lcod.notegen.validation;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.notegen.shared.Severity;

/**
 * Template authoring problem. {@code path} is the dotted chain of component ids; {@code slotId} is
 * null for component-level issues.
 */
public record TemplateLintIssue(
    String code,
    String message,
    Severity severity,
    String componentId,
    String path,
    String slotId
) {
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("code", code);
        out.put("message", message);
        out.put("severity", severity.wireName());
        out.put("componentId", componentId);
        out.put("path", path);
        if (slotId != null) {
            out.put("slotId", slotId);
        }
        return out;
    }
}

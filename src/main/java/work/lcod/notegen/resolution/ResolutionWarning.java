package work.lcod.notegen.resolution;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.notegen.shared.Severity;
import work.lcod.notegen.template.SlotKind;

public record ResolutionWarning(
    String componentId,
    String slotId,
    SlotKind slot,
    String path,
    WarningReason reason,
    Severity severity,
    String message
) {
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("componentId", componentId);
        out.put("slotId", slotId);
        out.put("slot", slot.wireName());
        out.put("path", path);
        out.put("reason", reason.wireName());
        out.put("severity", severity.wireName());
        out.put("message", message);
        return out;
    }
}

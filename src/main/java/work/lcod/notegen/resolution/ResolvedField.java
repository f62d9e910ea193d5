package work.lcod.notegen.resolution;

import java.util.Objects;
import work.lcod.notegen.template.SlotKind;

/**
 * Value produced by one resolver invocation and the snapshot path it belongs at.
 */
public record ResolvedField(String path, Object value, SlotKind slot) {
    public ResolvedField {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(slot, "slot");
    }
}

package work.lcod.notegen.composition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data shipped to the model alongside the instructions. {@code factPack} is null when none was supplied.
 */
public record PromptContext(Map<String, Object> factPack, Map<String, Object> nasSlices) {
    public PromptContext {
        factPack = factPack == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(factPack));
        nasSlices = nasSlices == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nasSlices));
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        if (factPack != null) {
            out.put("factPack", factPack);
        }
        out.put("nasSlices", nasSlices);
        return out;
    }
}

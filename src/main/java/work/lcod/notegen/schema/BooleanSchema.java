package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import java.util.Map;

public record BooleanSchema() implements SchemaNode {
    @Override
    public SchemaType type() {
        return SchemaType.BOOLEAN;
    }

    @Override
    public BooleanSchema copy() {
        return this;
    }

    @Override
    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", type().wireName());
        return out;
    }
}

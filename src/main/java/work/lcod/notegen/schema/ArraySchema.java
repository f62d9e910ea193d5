package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record ArraySchema(SchemaNode items) implements SchemaNode {
    public ArraySchema {
        Objects.requireNonNull(items, "items");
    }

    @Override
    public SchemaType type() {
        return SchemaType.ARRAY;
    }

    @Override
    public ArraySchema copy() {
        return new ArraySchema(items.copy());
    }

    @Override
    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", type().wireName());
        out.put("items", items.toJson());
        return out;
    }
}

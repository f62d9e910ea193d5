package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import java.util.Map;

public record NumberSchema(Double minimum, Double maximum) implements SchemaNode {
    public static NumberSchema unbounded() {
        return new NumberSchema(null, null);
    }

    @Override
    public SchemaType type() {
        return SchemaType.NUMBER;
    }

    @Override
    public NumberSchema copy() {
        return this;
    }

    @Override
    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", type().wireName());
        if (minimum != null) {
            out.put("minimum", compact(minimum));
        }
        if (maximum != null) {
            out.put("maximum", compact(maximum));
        }
        return out;
    }

    private static Number compact(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return (long) value;
        }
        return value;
    }
}

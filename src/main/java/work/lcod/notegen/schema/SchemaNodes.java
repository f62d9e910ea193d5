package work.lcod.notegen.schema;

import java.util.Map;
import work.lcod.notegen.shared.Values;
import work.lcod.notegen.template.ContentConstraints;

/**
 * Constructors for schema nodes and the single place where properties are attached to objects.
 */
public final class SchemaNodes {
    private SchemaNodes() {}

    public static ObjectSchema objectNode() {
        return new ObjectSchema(false);
    }

    public static ObjectSchema objectNode(boolean additionalProperties) {
        return new ObjectSchema(additionalProperties);
    }

    public static ArraySchema arrayNode(SchemaNode items) {
        return new ArraySchema(items);
    }

    public static StringSchema stringNode() {
        return StringSchema.plain();
    }

    public static StringSchema stringNode(ContentConstraints constraints) {
        if (constraints == null) {
            return StringSchema.plain();
        }
        return new StringSchema(
            constraints.enumValues(),
            constraints.pattern(),
            constraints.minWords(),
            constraints.maxWords(),
            constraints.minSentences(),
            constraints.maxSentences()
        );
    }

    public static NumberSchema numberNode() {
        return NumberSchema.unbounded();
    }

    public static NumberSchema numberNode(Double minimum, Double maximum) {
        return new NumberSchema(minimum, maximum);
    }

    public static BooleanSchema booleanNode() {
        return new BooleanSchema();
    }

    public static void addProperty(ObjectSchema target, String name, SchemaNode child, PropertyOptions options) {
        if (target.hasProperty(name)) {
            throw new DuplicatePathException(options.path(), options.sourceId(), name);
        }
        target.put(name, child);
        if (options.required()) {
            target.markRequired(name);
        }
    }

    /**
     * Reads a node back from its JSON form (as produced by {@link SchemaNode#toJson()}).
     */
    public static SchemaNode fromJson(Map<String, Object> json) {
        var type = SchemaType.fromWire(Values.asString(json.get("type")));
        switch (type) {
            case OBJECT: {
                var node = new ObjectSchema(Boolean.TRUE.equals(json.get("additionalProperties")));
                var props = Values.castMap(json.get("properties"));
                if (props != null) {
                    props.forEach((name, child) -> node.put(name, fromJson(Values.castMap(child))));
                }
                Values.asStringList(json.get("required")).forEach(node::markRequired);
                return node;
            }
            case ARRAY: {
                var items = Values.castMap(json.get("items"));
                if (items == null) {
                    throw new IllegalArgumentException("Array schema node without items");
                }
                return new ArraySchema(fromJson(items));
            }
            case NUMBER:
                return new NumberSchema(Values.asDouble(json.get("minimum")), Values.asDouble(json.get("maximum")));
            case BOOLEAN:
                return new BooleanSchema();
            default:
                return new StringSchema(
                    json.containsKey("enum") ? Values.asStringList(json.get("enum")) : null,
                    Values.asString(json.get("pattern")),
                    Values.asInteger(json.get(StringSchema.MIN_WORDS)),
                    Values.asInteger(json.get(StringSchema.MAX_WORDS)),
                    Values.asInteger(json.get(StringSchema.MIN_SENTENCES)),
                    Values.asInteger(json.get(StringSchema.MAX_SENTENCES))
                );
        }
    }
}

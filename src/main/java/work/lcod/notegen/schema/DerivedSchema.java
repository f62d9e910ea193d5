package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.notegen.shared.Values;

/**
 * A complete JSON Schema document (draft 2020-12) wrapping a closed root object.
 */
public record DerivedSchema(String id, String title, String description, ObjectSchema root) {
    public static final String DRAFT = "https://json-schema.org/draft/2020-12/schema";

    public DerivedSchema {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(root, "root");
    }

    public Map<String, SchemaNode> properties() {
        return root.properties();
    }

    public List<String> required() {
        return root.required();
    }

    /**
     * Finds the node at a dotted path, descending through array items transparently.
     */
    public SchemaNode nodeAt(String dottedPath) {
        SchemaNode current = root;
        for (var piece : dottedPath.replace("[]", "").replaceAll("\\[\\d+]", "").split("\\.")) {
            while (current instanceof ArraySchema array) {
                current = array.items();
            }
            if (!(current instanceof ObjectSchema object) || !object.hasProperty(piece)) {
                return null;
            }
            current = object.property(piece);
        }
        return current;
    }

    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        out.put("$id", id);
        out.put("$schema", DRAFT);
        out.put("title", title);
        if (description != null) {
            out.put("description", description);
        }
        out.put("type", SchemaType.OBJECT.wireName());
        out.put("properties", root.propertiesJson());
        if (!root.required().isEmpty()) {
            out.put("required", List.copyOf(root.required()));
        }
        out.put("additionalProperties", false);
        return out;
    }

    public static DerivedSchema fromJson(Map<String, Object> json) {
        var root = (ObjectSchema) SchemaNodes.fromJson(rootOnly(json));
        return new DerivedSchema(
            Values.asString(json.get("$id")),
            Values.asString(json.get("title")),
            Values.asString(json.get("description")),
            root
        );
    }

    private static Map<String, Object> rootOnly(Map<String, Object> json) {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", SchemaType.OBJECT.wireName());
        out.put("properties", json.get("properties"));
        out.put("required", json.get("required"));
        out.put("additionalProperties", false);
        return out;
    }
}

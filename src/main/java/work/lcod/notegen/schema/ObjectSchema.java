package work.lcod.notegen.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Object node. Properties are appended while a schema is being derived; callers outside this
 * package only see read-only views.
 */
public final class ObjectSchema implements SchemaNode {
    private final Map<String, SchemaNode> properties = new LinkedHashMap<>();
    private final List<String> required = new ArrayList<>();
    private final boolean additionalProperties;

    ObjectSchema(boolean additionalProperties) {
        this.additionalProperties = additionalProperties;
    }

    @Override
    public SchemaType type() {
        return SchemaType.OBJECT;
    }

    public Map<String, SchemaNode> properties() {
        return Collections.unmodifiableMap(properties);
    }

    public List<String> required() {
        return Collections.unmodifiableList(required);
    }

    public boolean additionalProperties() {
        return additionalProperties;
    }

    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    public SchemaNode property(String name) {
        return properties.get(name);
    }

    void put(String name, SchemaNode node) {
        properties.put(name, node);
    }

    void markRequired(String name) {
        if (!required.contains(name)) {
            required.add(name);
        }
    }

    @Override
    public ObjectSchema copy() {
        var copy = new ObjectSchema(additionalProperties);
        properties.forEach((name, node) -> copy.put(name, node.copy()));
        required.forEach(copy::markRequired);
        return copy;
    }

    @Override
    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", type().wireName());
        out.put("properties", propertiesJson());
        if (!required.isEmpty()) {
            out.put("required", List.copyOf(required));
        }
        out.put("additionalProperties", additionalProperties);
        return out;
    }

    Map<String, Object> propertiesJson() {
        var props = new LinkedHashMap<String, Object>();
        properties.forEach((name, node) -> props.put(name, node.toJson()));
        return props;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ObjectSchema that
            && additionalProperties == that.additionalProperties
            && properties.equals(that.properties)
            && required.equals(that.required);
    }

    @Override
    public int hashCode() {
        return properties.hashCode() * 31 + required.hashCode() + (additionalProperties ? 1 : 0);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}

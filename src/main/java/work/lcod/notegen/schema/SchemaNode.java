package work.lcod.notegen.schema;

import java.util.Map;

/**
 * A JSON Schema node with exactly one shape per {@link SchemaType}.
 */
public interface SchemaNode {
    SchemaType type();

    /**
     * Ordered JSON representation of this node and its descendants.
     */
    Map<String, Object> toJson();

    /**
     * Deep copy; merged results never share mutable object nodes with their inputs.
     */
    SchemaNode copy();
}

package work.lcod.notegen.schema;

import java.util.Locale;

public enum SchemaType {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SchemaType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Schema node type is required");
        }
        try {
            return SchemaType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported schema node type: " + value, ex);
        }
    }
}

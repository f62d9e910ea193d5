package work.lcod.notegen.template;

import java.util.Locale;

/**
 * How a content item's value is produced.
 */
public enum SlotKind {
    STATIC("static"),
    MODEL("model"),
    LOOKUP("lookup"),
    COMPUTED("computed"),
    VERBATIM("verbatim");

    private final String wireName;

    SlotKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isModel() {
        return this == MODEL;
    }

    /**
     * Parses the template value; the legacy {@code ai} tag is read as {@link #MODEL}.
     */
    public static SlotKind fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Slot kind is required");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("ai".equals(normalized)) {
            return MODEL;
        }
        for (var kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported slot kind: " + value);
    }
}

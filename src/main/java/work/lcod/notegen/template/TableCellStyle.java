package work.lcod.notegen.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.notegen.shared.Values;

/**
 * Presentation hints for a value rendered inside a table cell.
 */
public record TableCellStyle(
    String role,
    Integer columnIndex,
    Boolean muted,
    Boolean italic,
    Boolean bold,
    String emphasis,
    List<String> droppedKeys,
    List<String> invalidKeys
) {
    static final Set<String> KNOWN_KEYS = Set.of("role", "columnIndex", "muted", "italic", "bold", "emphasis");

    public TableCellStyle {
        droppedKeys = droppedKeys == null ? List.of() : List.copyOf(droppedKeys);
        invalidKeys = invalidKeys == null ? List.of() : List.copyOf(invalidKeys);
    }

    static TableCellStyle fromMap(Map<String, Object> raw) {
        var dropped = new ArrayList<String>();
        var invalid = new ArrayList<String>();
        for (var key : raw.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                dropped.add(key);
            }
        }
        Integer columnIndex = null;
        var rawIndex = raw.get("columnIndex");
        if (rawIndex != null) {
            if (rawIndex instanceof Integer || rawIndex instanceof Long) {
                columnIndex = ((Number) rawIndex).intValue();
            } else {
                invalid.add("columnIndex");
            }
        }
        return new TableCellStyle(
            Values.asString(raw.get("role")),
            columnIndex,
            Values.asBoolean(raw.get("muted")),
            Values.asBoolean(raw.get("italic")),
            Values.asBoolean(raw.get("bold")),
            Values.asString(raw.get("emphasis")),
            dropped,
            invalid
        );
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        if (role != null) {
            out.put("role", role);
        }
        if (columnIndex != null) {
            out.put("columnIndex", columnIndex);
        }
        if (muted != null) {
            out.put("muted", muted);
        }
        if (italic != null) {
            out.put("italic", italic);
        }
        if (bold != null) {
            out.put("bold", bold);
        }
        if (emphasis != null) {
            out.put("emphasis", emphasis);
        }
        return out;
    }
}

package work.lcod.notegen.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.notegen.shared.Values;

/**
 * Closed set of presentation hints. Unknown keys are dropped; {@code droppedKeys} lists them
 * with nested keys prefixed by their parent ({@code tableCell.color}).
 */
public record StyleHints(String tone, TableCellStyle tableCell, List<String> droppedKeys) {
    static final Set<String> KNOWN_KEYS = Set.of("tone", "tableCell");

    public StyleHints {
        droppedKeys = droppedKeys == null ? List.of() : List.copyOf(droppedKeys);
    }

    public static StyleHints fromMap(Map<String, Object> raw) {
        if (raw == null) {
            return null;
        }
        var dropped = new ArrayList<String>();
        TableCellStyle tableCell = null;
        for (var entry : raw.entrySet()) {
            var key = entry.getKey();
            if (!KNOWN_KEYS.contains(key)) {
                dropped.add(key);
            } else if ("tableCell".equals(key)) {
                var nested = Values.castMap(entry.getValue());
                if (nested == null) {
                    dropped.add(key);
                } else {
                    tableCell = TableCellStyle.fromMap(nested);
                    for (var nestedKey : tableCell.droppedKeys()) {
                        dropped.add("tableCell." + nestedKey);
                    }
                }
            }
        }
        return new StyleHints(Values.asString(raw.get("tone")), tableCell, dropped);
    }

    public boolean isEmpty() {
        return tone == null && (tableCell == null || tableCell.toMap().isEmpty());
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        if (tone != null) {
            out.put("tone", tone);
        }
        if (tableCell != null) {
            var cell = tableCell.toMap();
            if (!cell.isEmpty()) {
                out.put("tableCell", cell);
            }
        }
        return out;
    }
}

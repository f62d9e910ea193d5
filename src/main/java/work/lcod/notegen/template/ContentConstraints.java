package work.lcod.notegen.template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.notegen.shared.Values;

/**
 * Authoring constraints on a content item. Unknown keys are dropped at load time and kept in
 * {@code droppedKeys} so linters can report them.
 */
public record ContentConstraints(
    boolean required,
    List<String> enumValues,
    String pattern,
    Integer minWords,
    Integer maxWords,
    Integer minSentences,
    Integer maxSentences,
    List<String> droppedKeys
) {
    static final Set<String> KNOWN_KEYS = Set.of(
        "required", "enum", "pattern", "minWords", "maxWords", "minSentences", "maxSentences"
    );

    public ContentConstraints {
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
        droppedKeys = droppedKeys == null ? List.of() : List.copyOf(droppedKeys);
    }

    public static ContentConstraints empty() {
        return new ContentConstraints(false, null, null, null, null, null, null, List.of());
    }

    public static ContentConstraints requiredOnly() {
        return empty().withRequired(true);
    }

    public static ContentConstraints fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return empty();
        }
        var dropped = new ArrayList<String>();
        for (var key : raw.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                dropped.add(key);
            }
        }
        var enumRaw = raw.get("enum");
        return new ContentConstraints(
            Boolean.TRUE.equals(Values.asBoolean(raw.get("required"))),
            enumRaw == null ? null : Values.asStringList(enumRaw),
            Values.asString(raw.get("pattern")),
            Values.asInteger(raw.get("minWords")),
            Values.asInteger(raw.get("maxWords")),
            Values.asInteger(raw.get("minSentences")),
            Values.asInteger(raw.get("maxSentences")),
            dropped
        );
    }

    public ContentConstraints withRequired(boolean value) {
        return new ContentConstraints(value, enumValues, pattern, minWords, maxWords, minSentences, maxSentences, droppedKeys);
    }

    public ContentConstraints withEnum(List<String> values) {
        return new ContentConstraints(required, values, pattern, minWords, maxWords, minSentences, maxSentences, droppedKeys);
    }

    public ContentConstraints withPattern(String value) {
        return new ContentConstraints(required, enumValues, value, minWords, maxWords, minSentences, maxSentences, droppedKeys);
    }

    public ContentConstraints withWords(Integer min, Integer max) {
        return new ContentConstraints(required, enumValues, pattern, min, max, minSentences, maxSentences, droppedKeys);
    }

    public ContentConstraints withSentences(Integer min, Integer max) {
        return new ContentConstraints(required, enumValues, pattern, minWords, maxWords, min, max, droppedKeys);
    }

    /**
     * True when any value-shaping constraint (everything except {@code required}) is present.
     */
    public boolean hasValueConstraints() {
        return enumValues != null || pattern != null || minWords != null || maxWords != null
            || minSentences != null || maxSentences != null;
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        if (required) {
            out.put("required", true);
        }
        if (enumValues != null) {
            out.put("enum", enumValues);
        }
        if (pattern != null) {
            out.put("pattern", pattern);
        }
        putIfPresent(out, "minWords", minWords);
        putIfPresent(out, "maxWords", maxWords);
        putIfPresent(out, "minSentences", minSentences);
        putIfPresent(out, "maxSentences", maxSentences);
        return out;
    }

    private static void putIfPresent(Map<String, Object> out, String key, Object value) {
        if (value != null) {
            out.put(key, value);
        }
    }
}

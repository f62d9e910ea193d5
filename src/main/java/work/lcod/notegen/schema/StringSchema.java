package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * String node with optional enum, pattern and word/sentence bounds ({@code x-minWords} etc.).
 */
public record StringSchema(
    List<String> enumValues,
    String pattern,
    Integer minWords,
    Integer maxWords,
    Integer minSentences,
    Integer maxSentences
) implements SchemaNode {
    public static final String MIN_WORDS = "x-minWords";
    public static final String MAX_WORDS = "x-maxWords";
    public static final String MIN_SENTENCES = "x-minSentences";
    public static final String MAX_SENTENCES = "x-maxSentences";

    public StringSchema {
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
    }

    public static StringSchema plain() {
        return new StringSchema(null, null, null, null, null, null);
    }

    @Override
    public SchemaType type() {
        return SchemaType.STRING;
    }

    @Override
    public StringSchema copy() {
        return this;
    }

    @Override
    public Map<String, Object> toJson() {
        var out = new LinkedHashMap<String, Object>();
        out.put("type", type().wireName());
        if (enumValues != null) {
            out.put("enum", enumValues);
        }
        if (pattern != null) {
            out.put("pattern", pattern);
        }
        if (minWords != null) {
            out.put(MIN_WORDS, minWords);
        }
        if (maxWords != null) {
            out.put(MAX_WORDS, maxWords);
        }
        if (minSentences != null) {
            out.put(MIN_SENTENCES, minSentences);
        }
        if (maxSentences != null) {
            out.put(MAX_SENTENCES, maxSentences);
        }
        return out;
    }
}

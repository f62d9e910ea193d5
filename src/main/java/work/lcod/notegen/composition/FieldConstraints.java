package work.lcod.notegen.composition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.notegen.schema.StringSchema;
import work.lcod.notegen.template.ContentConstraints;

/**
 * Template constraints in schema vocabulary ({@code x-minWords} and friends).
 */
public record FieldConstraints(
    List<String> enumValues,
    String pattern,
    Integer minWords,
    Integer maxWords,
    Integer minSentences,
    Integer maxSentences
) {
    public FieldConstraints {
        enumValues = enumValues == null ? null : List.copyOf(enumValues);
    }

    public static FieldConstraints from(ContentConstraints constraints) {
        if (constraints == null || !constraints.hasValueConstraints()) {
            return null;
        }
        return new FieldConstraints(
            constraints.enumValues(),
            constraints.pattern(),
            constraints.minWords(),
            constraints.maxWords(),
            constraints.minSentences(),
            constraints.maxSentences()
        );
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        if (enumValues != null) {
            out.put("enum", enumValues);
        }
        if (pattern != null) {
            out.put("pattern", pattern);
        }
        if (minWords != null) {
            out.put(StringSchema.MIN_WORDS, minWords);
        }
        if (maxWords != null) {
            out.put(StringSchema.MAX_WORDS, maxWords);
        }
        if (minSentences != null) {
            out.put(StringSchema.MIN_SENTENCES, minSentences);
        }
        if (maxSentences != null) {
            out.put(StringSchema.MAX_SENTENCES, maxSentences);
        }
        return out;
    }
}

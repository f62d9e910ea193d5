package work.lcod.notegen.schema;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deep-merges the model and non-model schemas into the render payload schema.
 *
 * <p>Merging never mutates its inputs: every object node in the result is freshly built.</p>
 */
public final class SchemaMerger {
    private static final Logger logger = LoggerFactory.getLogger(SchemaMerger.class);

    private final String baseUrl;

    public SchemaMerger() {
        this(SchemaDeriver.DEFAULT_BASE_URL);
    }

    public SchemaMerger(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
    }

    public DerivedSchema merge(DerivedSchema modelSchema, DerivedSchema nonModelSchema, String templateId, String name, String version) {
        var merged = mergeObjects(modelSchema.root(), nonModelSchema.root(), "");
        logger.debug("Merged schemas for {}@{}: {} top-level properties", templateId, version, merged.properties().size());
        return new DerivedSchema(
            SchemaDeriver.schemaId(baseUrl, "render", templateId, version),
            "Render Payload - " + name + " v" + version,
            "Final payload schema (model and non-model fields) for " + name,
            merged
        );
    }

    /**
     * Dry run of {@link #merge}; throws the first conflict found.
     */
    public static void validateMergeable(DerivedSchema a, DerivedSchema b) {
        for (var entry : a.properties().entrySet()) {
            var other = b.properties().get(entry.getKey());
            if (other != null) {
                mergeNodes(entry.getValue(), other, entry.getKey());
            }
        }
    }

    public static SchemaNode mergeNodes(SchemaNode a, SchemaNode b, String path) {
        if (a.type() != b.type()) {
            throw new SchemaConflictException(
                SchemaConflictException.Kind.TYPE_CONFLICT,
                path,
                a.type().wireName() + " vs " + b.type().wireName()
            );
        }
        switch (a.type()) {
            case OBJECT:
                return mergeObjects((ObjectSchema) a, (ObjectSchema) b, path);
            case ARRAY:
                return new ArraySchema(mergeNodes(((ArraySchema) a).items(), ((ArraySchema) b).items(), path + "[]"));
            case STRING:
                return mergeStrings((StringSchema) a, (StringSchema) b, path);
            case NUMBER:
                return mergeNumbers((NumberSchema) a, (NumberSchema) b, path);
            default:
                return a.copy();
        }
    }

    private static ObjectSchema mergeObjects(ObjectSchema a, ObjectSchema b, String path) {
        var merged = SchemaNodes.objectNode(a.additionalProperties() && b.additionalProperties());
        for (var entry : a.properties().entrySet()) {
            var other = b.property(entry.getKey());
            var childPath = path.isEmpty() ? entry.getKey() : path + "." + entry.getKey();
            merged.put(entry.getKey(), other == null ? entry.getValue().copy() : mergeNodes(entry.getValue(), other, childPath));
        }
        for (var entry : b.properties().entrySet()) {
            if (!a.hasProperty(entry.getKey())) {
                merged.put(entry.getKey(), entry.getValue().copy());
            }
        }
        var required = new LinkedHashSet<String>(a.required());
        required.addAll(b.required());
        required.forEach(merged::markRequired);
        return merged;
    }

    private static StringSchema mergeStrings(StringSchema a, StringSchema b, String path) {
        List<String> enumValues;
        if (a.enumValues() != null && b.enumValues() != null) {
            var intersection = new ArrayList<String>();
            for (var value : a.enumValues()) {
                if (b.enumValues().contains(value) && !intersection.contains(value)) {
                    intersection.add(value);
                }
            }
            if (intersection.isEmpty()) {
                throw new SchemaConflictException(
                    SchemaConflictException.Kind.ENUM_CONFLICT,
                    path,
                    "no common values between " + a.enumValues() + " and " + b.enumValues()
                );
            }
            enumValues = intersection;
        } else {
            enumValues = a.enumValues() != null ? a.enumValues() : b.enumValues();
        }

        String pattern;
        if (a.pattern() != null && b.pattern() != null) {
            if (!a.pattern().equals(b.pattern())) {
                throw new SchemaConflictException(
                    SchemaConflictException.Kind.PATTERN_CONFLICT,
                    path,
                    "'" + a.pattern() + "' vs '" + b.pattern() + "'"
                );
            }
            pattern = a.pattern();
        } else {
            pattern = a.pattern() != null ? a.pattern() : b.pattern();
        }

        var minWords = max(a.minWords(), b.minWords());
        var maxWords = min(a.maxWords(), b.maxWords());
        checkBounds(path, StringSchema.MIN_WORDS, minWords, StringSchema.MAX_WORDS, maxWords);
        var minSentences = max(a.minSentences(), b.minSentences());
        var maxSentences = min(a.maxSentences(), b.maxSentences());
        checkBounds(path, StringSchema.MIN_SENTENCES, minSentences, StringSchema.MAX_SENTENCES, maxSentences);
        return new StringSchema(enumValues, pattern, minWords, maxWords, minSentences, maxSentences);
    }

    private static NumberSchema mergeNumbers(NumberSchema a, NumberSchema b, String path) {
        var minimum = max(a.minimum(), b.minimum());
        var maximum = min(a.maximum(), b.maximum());
        checkBounds(path, "minimum", minimum, "maximum", maximum);
        return new NumberSchema(minimum, maximum);
    }

    private static <T extends Comparable<T>> void checkBounds(String path, String lowerKey, T lower, String upperKey, T upper) {
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
            throw new SchemaConflictException(
                SchemaConflictException.Kind.CONSTRAINT_CONFLICT,
                path,
                lowerKey + " " + lower + " exceeds " + upperKey + " " + upper
            );
        }
    }

    private static <T extends Comparable<T>> T max(T a, T b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static <T extends Comparable<T>> T min(T a, T b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) <= 0 ? a : b;
    }
}

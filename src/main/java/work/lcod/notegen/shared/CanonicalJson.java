package work.lcod.notegen.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON text helpers shared by the prompt builder and the output writers.
 */
public final class CanonicalJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final DefaultPrettyPrinter PRINTER = new DefaultPrettyPrinter()
        .withObjectIndenter(new DefaultIndenter("  ", "\n"))
        .withArrayIndenter(new DefaultIndenter("  ", "\n"));
    private static final ObjectWriter PRETTY = MAPPER.writer(PRINTER);

    private CanonicalJson() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Pretty JSON with object keys sorted recursively; identical input always yields identical text.
     */
    public static String canonical(Object value) {
        return write(canonicalize(value));
    }

    /**
     * Pretty JSON keeping the insertion order of maps.
     */
    public static String pretty(Object value) {
        return write(value);
    }

    /**
     * Single-line JSON keeping insertion order.
     */
    public static String compact(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("json encode failed: " + ex.getOriginalMessage(), ex);
        }
    }

    public static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (var entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List<?> list) {
            List<Object> normalized = new ArrayList<>(list.size());
            for (Object item : list) {
                normalized.add(canonicalize(item));
            }
            return normalized;
        }
        return value;
    }

    private static String write(Object value) {
        try {
            return PRETTY.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("json encode failed: " + ex.getOriginalMessage(), ex);
        }
    }
}

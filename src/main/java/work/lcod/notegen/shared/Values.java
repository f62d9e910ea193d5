package work.lcod.notegen.shared;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the loosely typed maps and lists produced by Jackson.
 */
public final class Values {
    private Values() {}

    @SuppressWarnings("unchecked")
    public static Map<String, Object> castMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }

    public static List<Object> asList(Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return null;
    }

    public static String asString(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof String s ? s : String.valueOf(value);
    }

    public static List<String> asStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        var out = new ArrayList<String>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    out.add(String.valueOf(item));
                }
            }
        } else {
            out.add(String.valueOf(value));
        }
        return List.copyOf(out);
    }

    public static Integer asInteger(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public static Double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return null;
    }

    public static Boolean asBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str) {
            if ("true".equalsIgnoreCase(str.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(str.trim())) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    /**
     * Deep copy of nested maps and lists; scalars are shared.
     */
    public static Object cloneLiteral(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), cloneLiteral(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (Object item : list) {
                copy.add(cloneLiteral(item));
            }
            return copy;
        }
        return value;
    }
}

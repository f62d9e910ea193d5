package work.lcod.notegen.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.notegen.path.PathParser;
import work.lcod.notegen.path.PathSegment;
import work.lcod.notegen.shared.Values;

/**
 * Writes values into a nested map, creating intermediate objects and arrays on demand.
 * Indexed segments ({@code dx[2]}) pad the array with nulls up to the index.
 */
public final class PathSetter {
    private PathSetter() {}

    /**
     * Stores a deep copy of {@code value} so later writes never reach into caller-owned data.
     */
    public static void set(Map<String, Object> root, String path, Object rawValue) {
        var value = Values.cloneLiteral(rawValue);
        var segments = PathParser.parse(path);
        Map<String, Object> current = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            current = descend(current, segments.get(i), path);
        }
        var last = segments.get(segments.size() - 1);
        if (last.isIndexed()) {
            var list = listAt(current, last.name(), path);
            pad(list, last.index());
            list.set(last.index(), value);
        } else {
            var existing = current.get(last.name());
            if (existing instanceof Map<?, ?> && value instanceof Map<?, ?> incoming) {
                // keep fields written earlier by sibling items
                var merged = Values.castMap(existing);
                incoming.forEach((k, v) -> merged.put(String.valueOf(k), v));
            } else {
                current.put(last.name(), value);
            }
        }
    }

    private static Map<String, Object> descend(Map<String, Object> current, PathSegment segment, String path) {
        if (segment.isWildcard()) {
            throw new PathConflictException(path, "cannot write through wildcard segment '" + segment + "'");
        }
        if (segment.isIndexed()) {
            var list = listAt(current, segment.name(), path);
            pad(list, segment.index());
            var element = list.get(segment.index());
            if (element == null) {
                element = new LinkedHashMap<String, Object>();
                list.set(segment.index(), element);
            }
            var map = Values.castMap(element);
            if (map == null) {
                throw new PathConflictException(path, "element " + segment + " is not an object");
            }
            return map;
        }
        var next = current.get(segment.name());
        if (next == null) {
            next = new LinkedHashMap<String, Object>();
            current.put(segment.name(), next);
        }
        var map = Values.castMap(next);
        if (map == null) {
            throw new PathConflictException(path, "'" + segment.name() + "' already holds a non-object value");
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> listAt(Map<String, Object> current, String name, String path) {
        var existing = current.get(name);
        if (existing == null) {
            var created = new ArrayList<Object>();
            current.put(name, created);
            return created;
        }
        if (!(existing instanceof List<?>)) {
            throw new PathConflictException(path, "'" + name + "' already holds a non-array value");
        }
        return (List<Object>) existing;
    }

    private static void pad(List<Object> list, int index) {
        while (list.size() <= index) {
            list.add(null);
        }
    }
}

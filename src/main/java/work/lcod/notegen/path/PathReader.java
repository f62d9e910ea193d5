package work.lcod.notegen.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads values out of nested maps and lists by dotted path.
 *
 * <p>A trailing {@code name[]} yields the array itself; a {@code []} in the middle of a path
 * projects the remainder over every element and collects the values found.</p>
 */
public final class PathReader {
    private PathReader() {}

    public static Optional<Object> read(Object root, String path) {
        return read(root, PathParser.parse(path));
    }

    public static Optional<Object> read(Object root, List<PathSegment> segments) {
        return Optional.ofNullable(walk(root, segments, 0));
    }

    public static boolean exists(Object root, String path) {
        return read(root, path).isPresent();
    }

    private static Object walk(Object current, List<PathSegment> segments, int position) {
        if (position == segments.size()) {
            return current;
        }
        if (!(current instanceof Map<?, ?> map)) {
            return null;
        }
        var segment = segments.get(position);
        var value = map.get(segment.name());
        if (value == null) {
            return null;
        }
        if (!segment.isArray()) {
            return walk(value, segments, position + 1);
        }
        if (!(value instanceof List<?> list)) {
            return null;
        }
        if (segment.isIndexed()) {
            int index = segment.index();
            return index < list.size() ? walk(list.get(index), segments, position + 1) : null;
        }
        if (position == segments.size() - 1) {
            return list;
        }
        var projected = new ArrayList<Object>();
        for (Object element : list) {
            var found = walk(element, segments, position + 1);
            if (found != null) {
                projected.add(found);
            }
        }
        return projected.isEmpty() ? null : projected;
    }
}

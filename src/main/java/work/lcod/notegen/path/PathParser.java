package work.lcod.notegen.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses dotted output paths such as {@code plan.homework[].text} or {@code diagnoses[2]}.
 */
public final class PathParser {
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_-]*$");
    private static final Pattern INDEXED = Pattern.compile("^(.*)\\[(\\d+)]$");
    private static final String WILDCARD = "[]";

    private PathParser() {}

    public static List<PathSegment> parse(String path) {
        if (path == null || path.isEmpty()) {
            throw new InvalidPathException(path, "path is empty");
        }
        var pieces = path.split("\\.", -1);
        var segments = new ArrayList<PathSegment>(pieces.length);
        for (int i = 0; i < pieces.length; i++) {
            segments.add(parseSegment(path, pieces[i], i));
        }
        return List.copyOf(segments);
    }

    public static boolean isValid(String path) {
        try {
            parse(path);
            return true;
        } catch (InvalidPathException ex) {
            return false;
        }
    }

    public static String leafName(String path) {
        var segments = parse(path);
        return segments.get(segments.size() - 1).name();
    }

    public static Optional<String> parentPath(String path) {
        var segments = parse(path);
        if (segments.size() <= 1) {
            return Optional.empty();
        }
        return Optional.of(format(segments.subList(0, segments.size() - 1)));
    }

    public static boolean hasArraySegments(String path) {
        return parse(path).stream().anyMatch(PathSegment::isArray);
    }

    public static String format(List<PathSegment> segments) {
        var builder = new StringBuilder();
        for (var segment : segments) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(segment);
        }
        return builder.toString();
    }

    /**
     * Removes every {@code []} marker, keeping explicit indices.
     */
    public static String stripWildcards(String path) {
        return path == null ? null : path.replace(WILDCARD, "");
    }

    private static PathSegment parseSegment(String path, String piece, int position) {
        if (piece.isEmpty()) {
            throw new InvalidPathException(path, "empty segment at position " + position);
        }
        if (piece.endsWith(WILDCARD)) {
            var name = piece.substring(0, piece.length() - WILDCARD.length());
            requireName(path, name);
            return PathSegment.wildcard(name);
        }
        var indexed = INDEXED.matcher(piece);
        if (indexed.matches()) {
            var name = indexed.group(1);
            requireName(path, name);
            try {
                return PathSegment.indexed(name, Integer.parseInt(indexed.group(2)));
            } catch (NumberFormatException ex) {
                throw new InvalidPathException(path, "array index out of range in '" + piece + "'");
            }
        }
        requireName(path, piece);
        return PathSegment.plain(piece);
    }

    private static void requireName(String path, String name) {
        if (name.isEmpty()) {
            throw new InvalidPathException(path, "array marker without name");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new InvalidPathException(path, "invalid segment name '" + name + "'");
        }
    }
}

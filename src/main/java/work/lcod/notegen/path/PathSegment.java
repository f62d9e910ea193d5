package work.lcod.notegen.path;

import java.util.Objects;

/**
 * One dotted path piece: {@code name}, {@code name[]} or {@code name[N]}.
 */
public record PathSegment(String name, boolean isArray, Integer index) {
    public PathSegment {
        Objects.requireNonNull(name, "name");
        if (index != null && (!isArray || index < 0)) {
            throw new IllegalArgumentException("Indexed segment must be an array segment with a non-negative index");
        }
    }

    public static PathSegment plain(String name) {
        return new PathSegment(name, false, null);
    }

    public static PathSegment wildcard(String name) {
        return new PathSegment(name, true, null);
    }

    public static PathSegment indexed(String name, int index) {
        return new PathSegment(name, true, index);
    }

    public boolean isIndexed() {
        return index != null;
    }

    public boolean isWildcard() {
        return isArray && index == null;
    }

    @Override
    public String toString() {
        if (index != null) {
            return name + "[" + index + "]";
        }
        return isArray ? name + "[]" : name;
    }
}

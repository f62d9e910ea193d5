package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import work.lcod.notegen.shared.NotegenException;

/**
 * Explicit list-item indices are not 0..n-1.
 */
public final class SequentialIndexException extends NotegenException {
    private final String path;
    private final int found;
    private final int expected;

    public SequentialIndexException(String path, int found, int expected) {
        super(
            "sequential_index",
            "listItems array indices must be sequential starting from 0. Found index " + found
                + " but expected " + expected + " at path " + path,
            details(path, found, expected)
        );
        this.path = path;
        this.found = found;
        this.expected = expected;
    }

    public String path() {
        return path;
    }

    public int found() {
        return found;
    }

    public int expected() {
        return expected;
    }

    private static Object details(String path, int found, int expected) {
        var data = new LinkedHashMap<String, Object>();
        data.put("path", path);
        data.put("found", found);
        data.put("expected", expected);
        return data;
    }
}

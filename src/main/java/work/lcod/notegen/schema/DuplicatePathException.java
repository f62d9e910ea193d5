package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import work.lcod.notegen.shared.NotegenException;

/**
 * Two template leaves map to the same output location.
 */
public final class DuplicatePathException extends NotegenException {
    private final String path;
    private final String sourceId;
    private final String propertyName;

    public DuplicatePathException(String path, String sourceId, String propertyName) {
        super(
            "duplicate_path",
            "Duplicate path '" + path + "': property '" + propertyName + "' already defined (content item '" + sourceId + "')",
            details(path, sourceId, propertyName)
        );
        this.path = path;
        this.sourceId = sourceId;
        this.propertyName = propertyName;
    }

    public String path() {
        return path;
    }

    public String sourceId() {
        return sourceId;
    }

    public String propertyName() {
        return propertyName;
    }

    private static Object details(String path, String sourceId, String propertyName) {
        var data = new LinkedHashMap<String, Object>();
        data.put("path", path);
        data.put("sourceId", sourceId);
        data.put("propertyName", propertyName);
        return data;
    }
}

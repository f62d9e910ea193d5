package work.lcod.notegen.resolution;

import java.util.Map;
import work.lcod.notegen.shared.NotegenException;

/**
 * A snapshot write would descend through a value that is not a container.
 */
public final class PathConflictException extends NotegenException {
    public PathConflictException(String path, String reason) {
        super("type_mismatch", "Cannot write '" + path + "': " + reason, Map.of("path", path));
    }
}

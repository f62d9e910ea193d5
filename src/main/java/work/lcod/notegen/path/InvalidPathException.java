package work.lcod.notegen.path;

import java.util.Map;
import work.lcod.notegen.shared.NotegenException;

public final class InvalidPathException extends NotegenException {
    private final String path;

    public InvalidPathException(String path, String reason) {
        super("invalid_path", "Invalid path '" + path + "': " + reason, Map.of("path", String.valueOf(path), "reason", reason));
        this.path = path;
    }

    public String path() {
        return path;
    }
}

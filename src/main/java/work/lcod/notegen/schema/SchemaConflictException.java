package work.lcod.notegen.schema;

import java.util.LinkedHashMap;
import java.util.Locale;
import work.lcod.notegen.shared.NotegenException;

/**
 * Two schema nodes at the same path cannot be reconciled.
 */
public final class SchemaConflictException extends NotegenException {
    public enum Kind {
        TYPE_CONFLICT,
        ENUM_CONFLICT,
        PATTERN_CONFLICT,
        CONSTRAINT_CONFLICT;

        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final String path;

    public SchemaConflictException(Kind kind, String path, String detail) {
        super(kind.code(), label(kind) + " at '" + path + "': " + detail, details(kind, path, detail));
        this.kind = kind;
        this.path = path;
    }

    public Kind kind() {
        return kind;
    }

    public String path() {
        return path;
    }

    private static String label(Kind kind) {
        switch (kind) {
            case TYPE_CONFLICT:
                return "Type conflict";
            case ENUM_CONFLICT:
                return "Enum conflict";
            case PATTERN_CONFLICT:
                return "Pattern conflict";
            default:
                return "Constraint conflict";
        }
    }

    private static Object details(Kind kind, String path, String detail) {
        var data = new LinkedHashMap<String, Object>();
        data.put("kind", kind.code());
        data.put("path", path);
        data.put("detail", detail);
        return data;
    }
}

package work.lcod.notegen.shared;

/**
 * Base exception carrying a machine-readable code and optional data for compiler failures.
 */
public class NotegenException extends RuntimeException {
    private final String code;
    private final Object data;

    public NotegenException(String code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public NotegenException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}

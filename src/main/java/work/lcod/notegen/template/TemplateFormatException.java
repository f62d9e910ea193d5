package work.lcod.notegen.template;

import java.util.Map;
import work.lcod.notegen.shared.NotegenException;

/**
 * Raised when a template document cannot be turned into a {@link NoteTemplate}.
 */
public final class TemplateFormatException extends NotegenException {
    public TemplateFormatException(String message) {
        super("template_format", message, Map.of());
    }

    public TemplateFormatException(String message, Throwable cause) {
        super("template_format", message, Map.of(), cause);
    }
}

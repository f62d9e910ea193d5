package work.lcod.notegen.api;

import java.util.Map;
import work.lcod.notegen.shared.NotegenException;

public final class SettingsException extends NotegenException {
    public SettingsException(String message) {
        super("invalid_settings", message, Map.of());
    }

    public SettingsException(String message, Throwable cause) {
        super("invalid_settings", message, Map.of(), cause);
    }
}

package work.lcod.notegen.composition;

import java.util.Locale;

public enum MessageRole {
    SYSTEM,
    USER;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

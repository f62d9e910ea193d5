package work.lcod.notegen.shared;

import java.util.Locale;

public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

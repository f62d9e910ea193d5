package work.lcod.notegen.formula;

/**
 * Display format applied to computed numeric values.
 */
public enum FormatHint {
    PLAIN("plain"),
    DELTA_SCORE("deltaScore"),
    PERCENT("percent");

    private final String wireName;

    FormatHint(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Unknown or absent hints format like {@link #PLAIN}.
     */
    public static FormatHint fromWire(String value) {
        if (value != null) {
            for (var hint : values()) {
                if (hint.wireName.equalsIgnoreCase(value.trim())) {
                    return hint;
                }
            }
        }
        return PLAIN;
    }
}

package work.lcod.notegen.composition;

/**
 * Where a model field's dependency is expected to be found: the sliced non-model snapshot or
 * the caller's fact pack.
 */
public enum DependencyScope {
    NAS("nas"),
    SOURCE("source");

    private final String wireName;

    DependencyScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * {@code SOURCE} when the first dotted segment is exactly {@code source}; {@code sourceNotes.x}
     * stays {@code NAS}.
     */
    public static DependencyScope classify(String path) {
        if (path == null) {
            return NAS;
        }
        var first = path.split("\\.", 2)[0].replace("[]", "");
        return "source".equals(first) ? SOURCE : NAS;
    }
}

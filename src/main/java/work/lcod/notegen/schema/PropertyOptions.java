package work.lcod.notegen.schema;

/**
 * Metadata attached when a property is added: whether it is required, plus the full template path
 * and content item id used in duplicate-path diagnostics.
 */
public record PropertyOptions(boolean required, String path, String sourceId) {
    public static PropertyOptions optional(String path, String sourceId) {
        return new PropertyOptions(false, path, sourceId);
    }
}

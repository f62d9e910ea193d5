package work.lcod.notegen.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.notegen.resolution.VerbatimResolver;
import work.lcod.notegen.schema.SchemaDeriver;

/**
 * Tunables read from {@code notegen.toml}; see {@link SettingsLoader}.
 */
public record CompilerSettings(String schemaBaseUrl, int verbatimCharsPerSecond, boolean failOnWarnings) {
    public CompilerSettings {
        Objects.requireNonNull(schemaBaseUrl, "schemaBaseUrl");
        if (verbatimCharsPerSecond <= 0) {
            throw new SettingsException("verbatim.chars_per_second must be positive, got " + verbatimCharsPerSecond);
        }
    }

    public static CompilerSettings defaults() {
        return new CompilerSettings(SchemaDeriver.DEFAULT_BASE_URL, VerbatimResolver.DEFAULT_CHARS_PER_SECOND, false);
    }

    public Map<String, Object> toMap() {
        var out = new LinkedHashMap<String, Object>();
        out.put("schemaBaseUrl", schemaBaseUrl);
        out.put("verbatimCharsPerSecond", verbatimCharsPerSecond);
        out.put("failOnWarnings", failOnWarnings);
        return out;
    }
}

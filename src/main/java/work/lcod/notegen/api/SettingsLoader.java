package work.lcod.notegen.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Reads {@link CompilerSettings} from TOML. Missing keys keep their defaults; keys of the wrong
 * type are rejected.
 *
 * <pre>
 * [schema]
 * base_url = "https://notegen.local/generated"
 * [verbatim]
 * chars_per_second = 15
 * [lint]
 * fail_on_warnings = false
 * </pre>
 */
public final class SettingsLoader {
    private static final Logger logger = LoggerFactory.getLogger(SettingsLoader.class);

    private SettingsLoader() {}

    public static CompilerSettings load(Path path) {
        if (path == null) {
            return CompilerSettings.defaults();
        }
        try {
            var settings = parse(Files.readString(path));
            logger.debug("Loaded settings from {}: {}", path, settings);
            return settings;
        } catch (IOException ex) {
            throw new SettingsException("Unable to read settings file " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static CompilerSettings parse(String toml) {
        TomlParseResult result = Toml.parse(toml);
        if (result.hasErrors()) {
            var reasons = result.errors().stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; "));
            throw new SettingsException("Invalid settings TOML: " + reasons);
        }
        var defaults = CompilerSettings.defaults();

        var baseUrl = defaults.schemaBaseUrl();
        if (result.contains("schema.base_url")) {
            if (!result.isString("schema.base_url") || result.getString("schema.base_url").isBlank()) {
                throw new SettingsException("schema.base_url must be a non-empty string");
            }
            baseUrl = stripTrailingSlash(result.getString("schema.base_url"));
        }

        int charsPerSecond = defaults.verbatimCharsPerSecond();
        if (result.contains("verbatim.chars_per_second")) {
            if (!result.isLong("verbatim.chars_per_second")) {
                throw new SettingsException("verbatim.chars_per_second must be an integer");
            }
            charsPerSecond = Math.toIntExact(result.getLong("verbatim.chars_per_second"));
        }

        boolean failOnWarnings = defaults.failOnWarnings();
        if (result.contains("lint.fail_on_warnings")) {
            if (!result.isBoolean("lint.fail_on_warnings")) {
                throw new SettingsException("lint.fail_on_warnings must be a boolean");
            }
            failOnWarnings = result.getBoolean("lint.fail_on_warnings");
        }
        return new CompilerSettings(baseUrl, charsPerSecond, failOnWarnings);
    }

    private static String stripTrailingSlash(String value) {
        var trimmed = value.trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}

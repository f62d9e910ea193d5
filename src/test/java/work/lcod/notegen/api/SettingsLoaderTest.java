package work.lcod.notegen.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.lcod.notegen.schema.SchemaDeriver;
import work.lcod.notegen.support.NotegenTestSupport;

class SettingsLoaderTest {
    @Test
    void readsFixtureSettings() {
        var settings = SettingsLoader.load(NotegenTestSupport.resource("settings", "notegen.toml"));
        assertEquals("https://example.test/schemas", settings.schemaBaseUrl());
        assertEquals(20, settings.verbatimCharsPerSecond());
        assertTrue(settings.failOnWarnings());
    }

    @Test
    void missingFileOrKeysFallBackToDefaults() {
        assertEquals(CompilerSettings.defaults(), SettingsLoader.load(null));
        var partial = SettingsLoader.parse("[lint]\nfail_on_warnings = true\n");
        assertEquals(SchemaDeriver.DEFAULT_BASE_URL, partial.schemaBaseUrl());
        assertEquals(15, partial.verbatimCharsPerSecond());
        assertTrue(partial.failOnWarnings());
        assertFalse(SettingsLoader.parse("").failOnWarnings());
    }

    @Test
    void rejectsWrongTypesAndBadValues() {
        var wrongType = assertThrows(
            SettingsException.class,
            () -> SettingsLoader.parse("[verbatim]\nchars_per_second = \"fast\"\n")
        );
        assertEquals("invalid_settings", wrongType.code());
        assertThrows(SettingsException.class, () -> SettingsLoader.parse("[lint]\nfail_on_warnings = 1\n"));
        assertThrows(SettingsException.class, () -> SettingsLoader.parse("[schema]\nbase_url = \"\"\n"));
        assertThrows(SettingsException.class, () -> SettingsLoader.parse("[verbatim]\nchars_per_second = 0\n"));
    }

    @Test
    void rejectsMalformedToml() {
        var ex = assertThrows(SettingsException.class, () -> SettingsLoader.parse("[schema\nbase_url = 1"));
        assertTrue(ex.getMessage().startsWith("Invalid settings TOML"));
        assertThrows(
            SettingsException.class,
            () -> SettingsLoader.load(NotegenTestSupport.resource("settings", "missing.toml"))
        );
    }
}

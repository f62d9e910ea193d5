package work.lcod.notegen.support;

import java.nio.file.Path;
import java.util.List;
import work.lcod.notegen.template.Component;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.SlotKind;
import work.lcod.notegen.template.TemplateLoader;

/**
 * Shared fixtures and small template builders for the test suites.
 */
public final class NotegenTestSupport {
    private NotegenTestSupport() {}

    public static Path resource(String first, String... more) {
        return Path.of("src", "test", "resources").resolve(Path.of(first, more)).toAbsolutePath();
    }

    public static Path progressNoteTemplate() {
        return resource("templates", "progress-note.yaml");
    }

    public static Path progressNoteSource() {
        return resource("sources", "progress-note-source.json");
    }

    public static Path progressNoteFacts() {
        return resource("sources", "progress-note-facts.json");
    }

    public static NoteTemplate loadProgressNote() {
        return TemplateLoader.loadFromFile(progressNoteTemplate());
    }

    public static NoteTemplate templateOf(ContentItem... items) {
        return NoteTemplate.of("test-note", "1.0.0", List.of(Component.section("main", List.of(items))));
    }

    public static ContentItem model(String id, String outputPath, String... deps) {
        return ContentItem.builder(id, SlotKind.MODEL)
            .outputPath(outputPath)
            .aiDeps(List.of(deps))
            .build();
    }

    public static ContentItem lookup(String id, String lookup, String targetPath) {
        return ContentItem.builder(id, SlotKind.LOOKUP)
            .lookup(lookup)
            .targetPath(targetPath)
            .build();
    }
}

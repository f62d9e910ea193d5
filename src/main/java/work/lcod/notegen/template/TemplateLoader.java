package work.lcod.notegen.template;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.notegen.shared.Values;

/**
 * Loads note templates from YAML or JSON documents (YAML being a superset, one mapper reads both).
 */
public final class TemplateLoader {
    private static final Logger logger = LoggerFactory.getLogger(TemplateLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private TemplateLoader() {}

    public static NoteTemplate loadFromFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            var template = parse(in);
            logger.debug("Loaded template {}@{} from {}", template.id(), template.version(), path);
            return template;
        } catch (IOException ex) {
            throw new TemplateFormatException("Failed to read template: " + path, ex);
        }
    }

    public static NoteTemplate parse(InputStream in) throws IOException {
        Map<String, Object> raw = YAML_MAPPER.readValue(in, MAP_TYPE);
        if (raw == null) {
            throw new TemplateFormatException("Template document is empty");
        }
        return fromMap(raw);
    }

    public static NoteTemplate parse(String document) {
        try {
            Map<String, Object> raw = YAML_MAPPER.readValue(document, MAP_TYPE);
            if (raw == null) {
                throw new TemplateFormatException("Template document is empty");
            }
            return fromMap(raw);
        } catch (IOException ex) {
            throw new TemplateFormatException("Invalid template document: " + ex.getMessage(), ex);
        }
    }

    public static NoteTemplate fromMap(Map<String, Object> raw) {
        var id = requireString(raw, "id", "template");
        var version = raw.get("version") == null ? null : String.valueOf(raw.get("version"));
        if (version == null || version.isBlank()) {
            throw new TemplateFormatException("Template '" + id + "' is missing a version");
        }
        var layout = new ArrayList<Component>();
        for (var entry : listOf(raw.get("layout"), "layout of template '" + id + "'")) {
            layout.add(toComponent(entry));
        }
        return new NoteTemplate(
            id,
            Values.asString(raw.get("name")),
            version,
            Values.asString(raw.get("description")),
            toPrompt(Values.castMap(raw.get("prompt"))),
            layout
        );
    }

    private static PromptConfig toPrompt(Map<String, Object> raw) {
        if (raw == null) {
            return PromptConfig.empty();
        }
        return new PromptConfig(
            Values.asString(raw.get("system")),
            Values.asString(raw.get("main")),
            Values.asStringList(raw.get("rules"))
        );
    }

    private static Component toComponent(Object node) {
        var raw = Values.castMap(node);
        if (raw == null) {
            throw new TemplateFormatException("Layout entries must be objects, got: " + node);
        }
        var id = requireString(raw, "id", "component");
        var content = new ArrayList<ContentItem>();
        for (var entry : listOf(raw.get("content"), "content of component '" + id + "'")) {
            content.add(toContentItem(entry, id));
        }
        var children = new ArrayList<Component>();
        for (var entry : listOf(raw.get("children"), "children of component '" + id + "'")) {
            children.add(toComponent(entry));
        }
        var props = Values.castMap(raw.get("props"));
        return new Component(
            id,
            Values.asString(raw.get("type")),
            Values.asString(raw.get("title")),
            props == null ? Map.of() : props,
            content,
            children
        );
    }

    private static ContentItem toContentItem(Object node, String componentId) {
        var raw = Values.castMap(node);
        if (raw == null) {
            throw new TemplateFormatException("Content items of component '" + componentId + "' must be objects");
        }
        var id = requireString(raw, "id", "content item in component '" + componentId + "'");
        SlotKind slot;
        try {
            slot = SlotKind.fromWire(Values.asString(raw.get("slot")));
        } catch (IllegalArgumentException ex) {
            throw new TemplateFormatException("Content item '" + id + "': " + ex.getMessage(), ex);
        }
        var builder = ContentItem.builder(id, slot)
            .outputPath(Values.asString(raw.get("outputPath")))
            .targetPath(Values.asString(raw.get("targetPath")))
            .description(Values.asString(raw.get("description")))
            .source(Values.asStringList(raw.get("source")))
            .guidance(Values.asStringList(raw.get("guidance")))
            .aiDeps(raw.containsKey("aiDeps") ? rawDeps(raw.get("aiDeps")) : null)
            .styleHints(StyleHints.fromMap(Values.castMap(raw.get("styleHints"))))
            .constraints(ContentConstraints.fromMap(Values.castMap(raw.get("constraints"))))
            .lookup(Values.asString(raw.get("lookup")))
            .formula(Values.asString(raw.get("formula")))
            .resultType(Values.asString(raw.get("resultType")))
            .format(Values.asString(raw.get("format")))
            .text(Values.asString(raw.get("text")))
            .verbatimRef(Values.asString(raw.get("verbatimRef")));
        for (var nested : listOf(raw.get("listItems"), "listItems of '" + id + "'")) {
            builder.listItem(toContentItem(nested, componentId));
        }
        var tableMap = raw.get("tableMap");
        if (tableMap instanceof Map<?, ?> cells) {
            for (var cell : cells.entrySet()) {
                builder.tableCell(String.valueOf(cell.getKey()), toContentItem(cell.getValue(), componentId));
            }
        } else if (tableMap instanceof List<?> cells) {
            int index = 0;
            for (var cell : cells) {
                builder.tableCell(String.valueOf(index++), toContentItem(cell, componentId));
            }
        }
        return builder.build();
    }

    /**
     * Keeps blank or non-string entries as empty strings so the template linter can flag them.
     */
    private static List<String> rawDeps(Object value) {
        if (!(value instanceof List<?> list)) {
            return value == null ? List.of() : List.of(value instanceof String s ? s : "");
        }
        var out = new ArrayList<String>(list.size());
        for (var entry : list) {
            out.add(entry instanceof String s ? s : "");
        }
        return out;
    }

    private static List<Object> listOf(Object value, String label) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?>)) {
            throw new TemplateFormatException("Expected a list for " + label);
        }
        return Values.asList(value);
    }

    private static String requireString(Map<String, Object> raw, String key, String owner) {
        var value = Values.asString(raw.get(key));
        if (value == null || value.isBlank()) {
            throw new TemplateFormatException("Missing '" + key + "' on " + owner);
        }
        return value;
    }
}

package work.lcod.notegen.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import work.lcod.notegen.shared.Values;

/**
 * Layout node: a section, table, list or header owning content items and child components.
 */
public record Component(
    String id,
    String type,
    String title,
    Map<String, Object> props,
    List<ContentItem> content,
    List<Component> children
) {
    public Component {
        Objects.requireNonNull(id, "id");
        type = type == null ? "section" : type;
        props = props == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(props));
        content = content == null ? List.of() : List.copyOf(content);
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Component section(String id, List<ContentItem> content) {
        return new Component(id, "section", null, Map.of(), content, List.of());
    }

    public Component withChildren(List<Component> newChildren) {
        return new Component(id, type, title, props, content, newChildren);
    }

    public boolean isTable() {
        return "table".equals(type);
    }

    /**
     * Column labels declared in {@code props.columns}; null when absent or not a list.
     */
    public List<String> columns() {
        var raw = props.get("columns");
        return raw instanceof List<?> ? Values.asStringList(raw) : null;
    }

    public List<Object> colWidths() {
        return Values.asList(props.get("colWidths"));
    }
}

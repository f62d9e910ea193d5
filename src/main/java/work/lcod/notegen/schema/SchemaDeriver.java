package work.lcod.notegen.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.notegen.path.PathParser;
import work.lcod.notegen.path.PathSegment;
import work.lcod.notegen.template.Component;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.SlotKind;
import work.lcod.notegen.template.TemplateFormatException;
import work.lcod.notegen.template.TemplateWalker;

/**
 * Derives the schema for one half of a template: the model-produced leaves or the non-model ones.
 */
public final class SchemaDeriver {
    public static final String DEFAULT_BASE_URL = "https://notegen.local/generated";

    private static final Logger logger = LoggerFactory.getLogger(SchemaDeriver.class);

    private final boolean modelHalf;
    private final String baseUrl;

    private SchemaDeriver(boolean modelHalf, String baseUrl) {
        this.modelHalf = modelHalf;
        this.baseUrl = trimSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
    }

    public static SchemaDeriver modelFields() {
        return modelFields(DEFAULT_BASE_URL);
    }

    public static SchemaDeriver modelFields(String baseUrl) {
        return new SchemaDeriver(true, baseUrl);
    }

    public static SchemaDeriver nonModelFields() {
        return nonModelFields(DEFAULT_BASE_URL);
    }

    public static SchemaDeriver nonModelFields(String baseUrl) {
        return new SchemaDeriver(false, baseUrl);
    }

    public static String schemaId(String baseUrl, String kind, String templateId, String version) {
        return trimSlash(baseUrl) + "/" + kind + "/" + templateId + "@" + version + ".json";
    }

    public DerivedSchema derive(NoteTemplate template) {
        var build = new Build();
        TemplateWalker.walk(template, new TemplateWalker.Visitor() {
            @Override
            public void visit(Component component, ContentItem item) {
                if (selects(item)) {
                    build.add(item);
                }
            }

            @Override
            public void beforeListItems(Component component, ContentItem parent) {
                checkSequentialIndices(parent);
            }
        });
        logger.debug(
            "Derived {} schema for {}@{} with {} top-level properties",
            modelHalf ? "model" : "non-model",
            template.id(),
            template.version(),
            build.root.properties().size()
        );
        if (modelHalf) {
            return new DerivedSchema(
                schemaId(baseUrl, "structured-output", template.id(), template.version()),
                "Structured Output - " + template.name() + " v" + template.version(),
                "Model-generated fields for " + template.name(),
                build.root
            );
        }
        return new DerivedSchema(
            schemaId(baseUrl, "non-model-output", template.id(), template.version()),
            "Non-model Output - " + template.name() + " v" + template.version(),
            "Non-model fields (lookup/computed/static/verbatim) for " + template.name(),
            build.root
        );
    }

    private boolean selects(ContentItem item) {
        return item.slot().isModel() == modelHalf;
    }

    private void checkSequentialIndices(ContentItem parent) {
        var indices = new ArrayList<Integer>();
        for (var child : parent.listItems()) {
            if (!selects(child) || child.declaredPath() == null) {
                continue;
            }
            var segments = PathParser.parse(child.declaredPath());
            var last = segments.get(segments.size() - 1);
            if (last.isIndexed()) {
                indices.add(last.index());
            }
        }
        indices.sort(Integer::compareTo);
        for (int i = 0; i < indices.size(); i++) {
            if (indices.get(i) != i) {
                var where = parent.declaredPath() != null ? parent.declaredPath() : parent.id();
                throw new SequentialIndexException(where, indices.get(i), i);
            }
        }
    }

    private SchemaNode leafFor(ContentItem item) {
        if (modelHalf) {
            return SchemaNodes.stringNode(item.constraints());
        }
        if (item.slot() == SlotKind.COMPUTED && item.resultType() != null) {
            switch (item.resultType().trim().toLowerCase(Locale.ROOT)) {
                case "number":
                    return SchemaNodes.numberNode();
                case "boolean":
                    return SchemaNodes.booleanNode();
                case "object":
                    return SchemaNodes.objectNode(true);
                case "array":
                    return SchemaNodes.arrayNode(SchemaNodes.stringNode());
                default:
                    return SchemaNodes.stringNode();
            }
        }
        if (item.slot() == SlotKind.VERBATIM) {
            var node = SchemaNodes.objectNode(false);
            SchemaNodes.addProperty(node, "text", SchemaNodes.stringNode(), new PropertyOptions(true, "text", item.id()));
            SchemaNodes.addProperty(node, "ref", SchemaNodes.stringNode(), new PropertyOptions(true, "ref", item.id()));
            return node;
        }
        return SchemaNodes.stringNode();
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Mutable state of one derivation run.
     */
    private final class Build {
        private final ObjectSchema root = SchemaNodes.objectNode();
        private final Map<String, ObjectSchema> nodes = new HashMap<>();
        private final Map<String, Set<Integer>> leafIndices = new HashMap<>();

        void add(ContentItem item) {
            var path = item.declaredPath();
            if (path == null || path.isBlank()) {
                if (modelHalf) {
                    throw new TemplateFormatException("Model content item '" + item.id() + "' is missing outputPath");
                }
                return;
            }
            var segments = PathParser.parse(path);
            ObjectSchema current = root;
            var currentPath = "";
            for (int i = 0; i < segments.size(); i++) {
                var segment = segments.get(i);
                var segmentPath = currentPath.isEmpty() ? segment.name() : currentPath + "." + segment.name();
                if (i == segments.size() - 1) {
                    addLeaf(current, segment, segmentPath, item);
                } else if (segment.isArray()) {
                    var arrayPath = segmentPath + "[]";
                    if (!nodes.containsKey(arrayPath)) {
                        var items = SchemaNodes.objectNode();
                        SchemaNodes.addProperty(current, segment.name(), SchemaNodes.arrayNode(items),
                            PropertyOptions.optional(arrayPath, item.id()));
                        nodes.put(arrayPath, items);
                    }
                    current = nodes.get(arrayPath);
                    currentPath = arrayPath;
                } else {
                    if (!nodes.containsKey(segmentPath)) {
                        var object = SchemaNodes.objectNode();
                        SchemaNodes.addProperty(current, segment.name(), object,
                            PropertyOptions.optional(segmentPath, item.id()));
                        nodes.put(segmentPath, object);
                    }
                    current = nodes.get(segmentPath);
                    currentPath = segmentPath;
                }
            }
        }

        private void addLeaf(ObjectSchema parent, PathSegment segment, String segmentPath, ContentItem item) {
            var leaf = leafFor(item);
            var options = new PropertyOptions(item.isRequired(), segment.isArray() ? segmentPath + "[]" : segmentPath, item.id());
            if (!segment.isArray()) {
                SchemaNodes.addProperty(parent, segment.name(), leaf, options);
                return;
            }
            if (!segment.isIndexed()) {
                SchemaNodes.addProperty(parent, segment.name(), SchemaNodes.arrayNode(leaf), options);
                return;
            }
            // indexed leaves (codes[0], codes[1]) share one array property
            var seen = leafIndices.computeIfAbsent(segmentPath, key -> new HashSet<>());
            if (seen.isEmpty()) {
                SchemaNodes.addProperty(parent, segment.name(), SchemaNodes.arrayNode(leaf), options);
            } else if (!seen.add(segment.index())) {
                throw new DuplicatePathException(segmentPath + "[" + segment.index() + "]", item.id(), segment.name());
            } else if (options.required()) {
                parent.markRequired(segment.name());
            }
            seen.add(segment.index());
        }
    }
}

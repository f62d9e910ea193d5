package work.lcod.notegen.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Leaf (or list/table container) of a template component.
 *
 * <p>{@code aiDeps} is {@code null} when the template does not declare the key, and an empty list when
 * it declares an empty one; the template linter reports the two cases differently.</p>
 */
public record ContentItem(
    String id,
    SlotKind slot,
    String outputPath,
    String targetPath,
    String description,
    List<String> source,
    List<String> guidance,
    List<String> aiDeps,
    StyleHints styleHints,
    ContentConstraints constraints,
    List<ContentItem> listItems,
    Map<String, ContentItem> tableMap,
    String lookup,
    String formula,
    String resultType,
    String format,
    String text,
    String verbatimRef
) {
    public ContentItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(slot, "slot");
        source = source == null ? List.of() : List.copyOf(source);
        guidance = guidance == null ? List.of() : List.copyOf(guidance);
        aiDeps = aiDeps == null ? null : Collections.unmodifiableList(new ArrayList<>(aiDeps));
        constraints = constraints == null ? ContentConstraints.empty() : constraints;
        listItems = listItems == null ? List.of() : List.copyOf(listItems);
        tableMap = tableMap == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tableMap));
    }

    public static Builder builder(String id, SlotKind slot) {
        return new Builder(id, slot);
    }

    public boolean isRequired() {
        return constraints.required();
    }

    /**
     * Path this item writes to: {@code outputPath} for model slots, {@code targetPath} otherwise.
     */
    public String declaredPath() {
        return slot.isModel() ? outputPath : targetPath;
    }

    public static final class Builder {
        private final String id;
        private final SlotKind slot;
        private String outputPath;
        private String targetPath;
        private String description;
        private List<String> source = List.of();
        private List<String> guidance = List.of();
        private List<String> aiDeps;
        private StyleHints styleHints;
        private ContentConstraints constraints;
        private final List<ContentItem> listItems = new ArrayList<>();
        private final Map<String, ContentItem> tableMap = new LinkedHashMap<>();
        private String lookup;
        private String formula;
        private String resultType;
        private String format;
        private String text;
        private String verbatimRef;

        private Builder(String id, SlotKind slot) {
            this.id = id;
            this.slot = slot;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder targetPath(String targetPath) {
            this.targetPath = targetPath;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder source(List<String> source) {
            this.source = source;
            return this;
        }

        public Builder guidance(List<String> guidance) {
            this.guidance = guidance;
            return this;
        }

        public Builder aiDeps(List<String> aiDeps) {
            this.aiDeps = aiDeps;
            return this;
        }

        public Builder styleHints(StyleHints styleHints) {
            this.styleHints = styleHints;
            return this;
        }

        public Builder constraints(ContentConstraints constraints) {
            this.constraints = constraints;
            return this;
        }

        public Builder listItem(ContentItem item) {
            this.listItems.add(item);
            return this;
        }

        public Builder tableCell(String column, ContentItem item) {
            this.tableMap.put(column, item);
            return this;
        }

        public Builder lookup(String lookup) {
            this.lookup = lookup;
            return this;
        }

        public Builder formula(String formula) {
            this.formula = formula;
            return this;
        }

        public Builder resultType(String resultType) {
            this.resultType = resultType;
            return this;
        }

        public Builder format(String format) {
            this.format = format;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder verbatimRef(String verbatimRef) {
            this.verbatimRef = verbatimRef;
            return this;
        }

        public ContentItem build() {
            return new ContentItem(
                id,
                slot,
                outputPath,
                targetPath,
                description,
                source,
                guidance,
                aiDeps,
                styleHints,
                constraints,
                listItems,
                tableMap,
                lookup,
                formula,
                resultType,
                format,
                text,
                verbatimRef
            );
        }
    }
}

package work.lcod.notegen.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import work.lcod.notegen.shared.Values;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.SlotKind;

/**
 * Quotes source text with provenance. The value is {@code {text, ref}} so rendering can cite it.
 *
 * <p>Locators: none (whole {@code text} or {@code content}), {@code t=START-END} (timestamped
 * {@code segments} within the range, or a characters-per-second slice of {@code text}) and
 * {@code p=N} (1-indexed entry of {@code pages}).</p>
 */
public final class VerbatimResolver implements SlotResolver {
    public static final int DEFAULT_CHARS_PER_SECOND = 15;

    private static final Pattern TIME_RANGE = Pattern.compile("^t=(\\d+)-(\\d+)$");
    private static final Pattern PAGE = Pattern.compile("^p=(\\d+)$");

    private final int charsPerSecond;

    public VerbatimResolver() {
        this(DEFAULT_CHARS_PER_SECOND);
    }

    public VerbatimResolver(int charsPerSecond) {
        if (charsPerSecond <= 0) {
            throw new IllegalArgumentException("charsPerSecond must be positive");
        }
        this.charsPerSecond = charsPerSecond;
    }

    @Override
    public boolean canResolve(SlotKind slot) {
        return slot == SlotKind.VERBATIM;
    }

    @Override
    public Optional<ResolvedField> resolve(ContentItem item, ResolutionContext context) {
        if (item.verbatimRef() == null || item.targetPath() == null) {
            return Optional.empty();
        }
        return VerbatimReference.parse(item.verbatimRef())
            .flatMap(ref -> extract(ref, context.sourceData()))
            .filter(text -> !text.isEmpty())
            .map(text -> {
                var value = new LinkedHashMap<String, Object>();
                value.put("text", text);
                value.put("ref", item.verbatimRef());
                return new ResolvedField(item.targetPath(), value, SlotKind.VERBATIM);
            });
    }

    private Optional<String> extract(VerbatimReference ref, Map<String, Object> sourceData) {
        var collection = Values.castMap(sourceData.get(ref.source()));
        var document = collection == null ? null : Values.castMap(collection.get(ref.id()));
        if (document == null) {
            return Optional.empty();
        }
        if (!ref.hasLocator()) {
            var text = Values.asString(document.get("text"));
            if (text == null || text.isEmpty()) {
                text = Values.asString(document.get("content"));
            }
            return Optional.ofNullable(text);
        }
        var range = TIME_RANGE.matcher(ref.locator());
        if (range.matches()) {
            return timeRange(document, Long.parseLong(range.group(1)), Long.parseLong(range.group(2)));
        }
        var page = PAGE.matcher(ref.locator());
        if (page.matches()) {
            return page(document, Integer.parseInt(page.group(1)));
        }
        return Optional.empty();
    }

    private Optional<String> timeRange(Map<String, Object> document, long start, long end) {
        var segments = document.get("segments");
        if (segments instanceof List<?> list) {
            var parts = new ArrayList<String>();
            for (var entry : list) {
                var segment = Values.castMap(entry);
                if (segment == null) {
                    continue;
                }
                var timestamp = Values.asDouble(segment.get("timestamp"));
                if (timestamp != null && timestamp >= start && timestamp <= end) {
                    parts.add(String.valueOf(segment.getOrDefault("text", "")));
                }
            }
            return Optional.of(String.join(" ", parts));
        }
        var text = Values.asString(document.get("text"));
        if (text == null) {
            return Optional.empty();
        }
        int from = (int) Math.min(text.length(), start * charsPerSecond);
        int to = (int) Math.min(text.length(), end * charsPerSecond);
        return Optional.of(from < to ? text.substring(from, to) : "");
    }

    private Optional<String> page(Map<String, Object> document, int pageNumber) {
        var pages = document.get("pages");
        if (!(pages instanceof List<?> list) || pageNumber < 1 || pageNumber > list.size()) {
            return Optional.empty();
        }
        var page = Values.castMap(list.get(pageNumber - 1));
        return page == null ? Optional.empty() : Optional.ofNullable(Values.asString(page.get("text")));
    }
}

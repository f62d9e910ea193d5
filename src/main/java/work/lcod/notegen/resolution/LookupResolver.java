package work.lcod.notegen.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import work.lcod.notegen.path.PathReader;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.SlotKind;

/**
 * Copies a value out of the source data.
 *
 * <p>When both the lookup and target paths contain {@code []}, each element of the source array is
 * projected into the target array ({@code diagnoses[].code} into {@code dx[].code}).</p>
 */
public final class LookupResolver implements SlotResolver {
    private static final String WILDCARD = "[]";

    @Override
    public boolean canResolve(SlotKind slot) {
        return slot == SlotKind.LOOKUP;
    }

    @Override
    public Optional<ResolvedField> resolve(ContentItem item, ResolutionContext context) {
        if (item.lookup() == null || item.targetPath() == null) {
            return Optional.empty();
        }
        if (item.lookup().contains(WILDCARD) && item.targetPath().contains(WILDCARD)) {
            return project(item.lookup(), item.targetPath(), context);
        }
        return PathReader.read(context.sourceData(), item.lookup())
            .map(value -> new ResolvedField(item.targetPath(), value, SlotKind.LOOKUP));
    }

    private Optional<ResolvedField> project(String lookupPath, String targetPath, ResolutionContext context) {
        var sourceRoot = head(lookupPath);
        var sourceTail = tail(lookupPath);
        var targetRoot = head(targetPath);
        var targetTail = tail(targetPath);

        var sourceArray = PathReader.read(context.sourceData(), sourceRoot + WILDCARD).orElse(null);
        if (!(sourceArray instanceof List<?> entries)) {
            return Optional.empty();
        }
        var projected = new ArrayList<Object>(entries.size());
        for (var entry : entries) {
            var raw = sourceTail.isEmpty() ? entry : PathReader.read(entry, sourceTail).orElse(null);
            if (targetTail.isEmpty()) {
                projected.add(raw);
            } else {
                var element = new LinkedHashMap<String, Object>();
                if (raw != null) {
                    PathSetter.set(element, targetTail, raw);
                }
                projected.add(element);
            }
        }
        return Optional.of(new ResolvedField(targetRoot, projected, SlotKind.LOOKUP));
    }

    private static String head(String path) {
        return path.substring(0, path.indexOf(WILDCARD));
    }

    private static String tail(String path) {
        var rest = path.substring(path.indexOf(WILDCARD) + WILDCARD.length());
        return rest.startsWith(".") ? rest.substring(1) : rest;
    }
}

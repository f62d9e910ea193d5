package work.lcod.notegen.composition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.notegen.path.InvalidPathException;
import work.lcod.notegen.path.PathParser;
import work.lcod.notegen.path.PathReader;
import work.lcod.notegen.shared.Values;

/**
 * Reduces the non-model snapshot to the top-level keys the model fields depend on.
 */
public final class ContextSlicer {
    private static final Logger logger = LoggerFactory.getLogger(ContextSlicer.class);

    private ContextSlicer() {}

    public static ContextSlice slice(Map<String, Object> snapshot, FieldGuide guide) {
        var source = snapshot == null ? Map.<String, Object>of() : snapshot;
        var slices = new LinkedHashMap<String, Object>();
        var issues = new ArrayList<LintIssue>();
        int nasDependencies = 0;
        for (var entry : guide.entries()) {
            for (var dependency : entry.dependencies()) {
                if (dependency.scope() != DependencyScope.NAS) {
                    continue;
                }
                nasDependencies++;
                var path = dependency.path();
                String rootKey;
                try {
                    rootKey = PathParser.parse(path).get(0).name();
                } catch (InvalidPathException e) {
                    issues.add(LintIssue.warning(
                        "context-slice.missing",
                        "Dependency path " + path + " for " + entry.path() + " is not a valid path: " + e.getMessage(),
                        entry.path()
                    ));
                    continue;
                }
                if (PathReader.read(source, path).isEmpty()) {
                    issues.add(LintIssue.warning(
                        "context-slice.missing",
                        "Dependency " + path + " for " + entry.path() + " is not present in the non-model snapshot.",
                        entry.path()
                    ));
                    continue;
                }
                if (!slices.containsKey(rootKey)) {
                    slices.put(rootKey, Values.cloneLiteral(source.get(rootKey)));
                }
            }
        }
        if (nasDependencies > 0 && slices.isEmpty()) {
            issues.add(LintIssue.error(
                "context-slice.empty",
                "None of the " + nasDependencies + " non-model dependencies resolved; the context slice is empty.",
                null
            ));
        }
        logger.debug("Sliced {} top-level keys from the non-model snapshot", slices.size());
        return new ContextSlice(slices, issues);
    }
}

package work.lcod.notegen.resolution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.notegen.path.PathParser;
import work.lcod.notegen.schema.DerivedSchema;
import work.lcod.notegen.shared.NotegenException;
import work.lcod.notegen.shared.Severity;
import work.lcod.notegen.template.Component;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.NoteTemplate;
import work.lcod.notegen.template.SlotKind;
import work.lcod.notegen.template.TemplateWalker;

/**
 * Resolves every non-model content item into the snapshot, in template traversal order.
 *
 * <p>Later items see values written by earlier ones through the partial snapshot. Per-field failures
 * never throw; they become warnings, promoted to errors for required items.</p>
 */
public final class ResolutionEngine {
    private static final Logger logger = LoggerFactory.getLogger(ResolutionEngine.class);

    private final ResolverRegistry registry;

    public ResolutionEngine(ResolverRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ResolutionResult build(NoteTemplate template, Map<String, Object> sourceData, DerivedSchema targetSchema) {
        var snapshot = new LinkedHashMap<String, Object>();
        var context = new ResolutionContext(template, sourceData, targetSchema, snapshot);
        var resolved = new ArrayList<ResolvedField>();
        var warnings = new ArrayList<ResolutionWarning>();

        TemplateWalker.walk(template, (component, item) -> {
            if (!item.slot().isModel()) {
                resolveItem(component, item, context, snapshot, resolved, warnings);
            }
        });

        logger.debug(
            "Resolved {} field(s) for {}@{} with {} warning(s)",
            resolved.size(),
            template.id(),
            template.version(),
            warnings.size()
        );
        return new ResolutionResult(snapshot, resolved, warnings);
    }

    private void resolveItem(
        Component component,
        ContentItem item,
        ResolutionContext context,
        Map<String, Object> snapshot,
        List<ResolvedField> resolved,
        List<ResolutionWarning> warnings
    ) {
        var resolver = registry.find(item.slot());
        if (resolver.isEmpty()) {
            warnings.add(warning(component, item, pathOf(item), WarningReason.MISSING_SOURCE, severityFor(item),
                "No resolver registered for slot kind: " + item.slot().wireName()));
            return;
        }

        Optional<ResolvedField> result;
        try {
            result = resolver.get().resolve(item, context);
        } catch (NotegenException ex) {
            logger.debug("Resolver for {} rejected item {}: {}", item.slot().wireName(), item.id(), ex.getMessage());
            warnings.add(warning(component, item, pathOf(item), failureReason(item.slot()), severityFor(item),
                "Failed to resolve " + item.slot().wireName() + " slot " + item.id() + ": " + ex.getMessage()));
            return;
        }
        if (result.isEmpty()) {
            warnings.add(warning(component, item, pathOf(item), failureReason(item.slot()), severityFor(item),
                "Failed to resolve " + item.slot().wireName() + " slot: " + item.id()));
            return;
        }

        var field = result.get();
        if (!covers(field.path(), item.targetPath())) {
            warnings.add(warning(component, item, field.path(), WarningReason.UNRESOLVED_SLOT, Severity.WARNING,
                "Resolver returned path '" + field.path() + "' for slot " + item.id()
                    + " whose target is '" + item.targetPath() + "'"));
            return;
        }

        try {
            PathSetter.set(snapshot, field.path(), field.value());
            resolved.add(field);
            logger.trace("Resolved {} -> {}", item.id(), field.path());
        } catch (NotegenException ex) {
            warnings.add(warning(component, item, field.path(), WarningReason.TYPE_MISMATCH, severityFor(item),
                "Failed to set value at path " + field.path() + ": " + ex.getMessage()));
        }
    }

    /**
     * A resolved path covers the target when they match once {@code []} markers are stripped, or
     * when it is the root of the target (array projections write the whole array at once).
     */
    static boolean covers(String resolvedPath, String targetPath) {
        if (targetPath == null) {
            return false;
        }
        var resolved = PathParser.stripWildcards(resolvedPath);
        var target = PathParser.stripWildcards(targetPath);
        return target.equals(resolved) || target.startsWith(resolved + ".");
    }

    private static WarningReason failureReason(SlotKind slot) {
        switch (slot) {
            case COMPUTED:
                return WarningReason.FORMULA_ERROR;
            case VERBATIM:
                return WarningReason.INVALID_REF;
            default:
                return WarningReason.MISSING_SOURCE;
        }
    }

    private static Severity severityFor(ContentItem item) {
        return item.isRequired() ? Severity.ERROR : Severity.WARNING;
    }

    private static String pathOf(ContentItem item) {
        return item.targetPath() != null ? item.targetPath() : "unknown";
    }

    private static ResolutionWarning warning(
        Component component,
        ContentItem item,
        String path,
        WarningReason reason,
        Severity severity,
        String message
    ) {
        return new ResolutionWarning(component.id(), item.id(), item.slot(), path, reason, severity, message);
    }
}

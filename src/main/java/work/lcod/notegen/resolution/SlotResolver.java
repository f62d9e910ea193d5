package work.lcod.notegen.resolution;

import java.util.Optional;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.SlotKind;

/**
 * Produces the value of one non-model content item.
 */
public interface SlotResolver {
    boolean canResolve(SlotKind slot);

    /**
     * Empty when the item cannot be resolved from the given context; the engine reports why.
     */
    Optional<ResolvedField> resolve(ContentItem item, ResolutionContext context);
}

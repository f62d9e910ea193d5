package work.lcod.notegen.resolution;

import java.util.Optional;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.SlotKind;

public final class StaticResolver implements SlotResolver {
    @Override
    public boolean canResolve(SlotKind slot) {
        return slot == SlotKind.STATIC;
    }

    @Override
    public Optional<ResolvedField> resolve(ContentItem item, ResolutionContext context) {
        if (item.text() == null || item.targetPath() == null) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedField(item.targetPath(), item.text(), SlotKind.STATIC));
    }
}

package work.lcod.notegen.resolution;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.notegen.formula.FormatHint;
import work.lcod.notegen.formula.FormulaEvaluator;
import work.lcod.notegen.formula.FormulaException;
import work.lcod.notegen.formula.FormulaScope;
import work.lcod.notegen.template.ContentItem;
import work.lcod.notegen.template.SlotKind;

/**
 * Evaluates a formula against the source data, falling back to values already in the snapshot,
 * then applies the item's display format when one is declared.
 */
public final class ComputedResolver implements SlotResolver {
    private static final Logger logger = LoggerFactory.getLogger(ComputedResolver.class);

    private final FormulaEvaluator evaluator;

    public ComputedResolver(FormulaEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    @Override
    public boolean canResolve(SlotKind slot) {
        return slot == SlotKind.COMPUTED;
    }

    @Override
    public Optional<ResolvedField> resolve(ContentItem item, ResolutionContext context) {
        if (item.formula() == null || item.targetPath() == null) {
            return Optional.empty();
        }
        Object value;
        try {
            value = evaluator.evaluate(item.formula(), FormulaScope.layered(context.sourceData(), context.partialSnapshot()));
        } catch (FormulaException ex) {
            logger.debug("Computed item {} failed: {}", item.id(), ex.getMessage());
            return Optional.empty();
        }
        if (value == null) {
            return Optional.empty();
        }
        if (item.format() != null) {
            value = FormulaEvaluator.format(value, FormatHint.fromWire(item.format()));
        }
        return Optional.of(new ResolvedField(item.targetPath(), value, SlotKind.COMPUTED));
    }
}

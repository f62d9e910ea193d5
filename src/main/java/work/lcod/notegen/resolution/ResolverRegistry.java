package work.lcod.notegen.resolution;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import work.lcod.notegen.formula.FormulaEvaluator;
import work.lcod.notegen.template.SlotKind;

/**
 * Ordered resolver list; the first resolver accepting a slot kind wins.
 */
public final class ResolverRegistry {
    private final List<SlotResolver> resolvers = new CopyOnWriteArrayList<>();

    public static ResolverRegistry createDefault(FormulaEvaluator evaluator) {
        return createDefault(evaluator, VerbatimResolver.DEFAULT_CHARS_PER_SECOND);
    }

    public static ResolverRegistry createDefault(FormulaEvaluator evaluator, int verbatimCharsPerSecond) {
        return new ResolverRegistry()
            .register(new LookupResolver())
            .register(new StaticResolver())
            .register(new ComputedResolver(evaluator))
            .register(new VerbatimResolver(verbatimCharsPerSecond));
    }

    public ResolverRegistry register(SlotResolver resolver) {
        resolvers.add(resolver);
        return this;
    }

    public Optional<SlotResolver> find(SlotKind slot) {
        for (var resolver : resolvers) {
            if (resolver.canResolve(slot)) {
                return Optional.of(resolver);
            }
        }
        return Optional.empty();
    }

    public List<SlotResolver> resolvers() {
        return List.copyOf(resolvers);
    }
}

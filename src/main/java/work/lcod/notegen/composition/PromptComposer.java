package work.lcod.notegen.composition;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link PromptBundle} from a template, its model schema and the resolved snapshot, then
 * lints it. Lint problems are returned, not thrown.
 */
public final class PromptComposer {
    private static final Logger logger = LoggerFactory.getLogger(PromptComposer.class);

    private final Clock clock;

    public PromptComposer() {
        this(Clock.systemUTC());
    }

    public PromptComposer(Clock clock) {
        this.clock = clock;
    }

    public CompositionResult compose(CompositionInput input) {
        var template = input.template();
        var guide = FieldGuideBuilder.build(template);
        var slice = ContextSlicer.slice(input.snapshot(), guide);

        var messages = MessageBuilder.build(template, guide.entries(), input.factPack(), slice.nasSlices());
        var bundle = new PromptBundle(
            bundleId(template.id(), template.version()),
            template.id(),
            template.version(),
            messages,
            input.modelSchema(),
            guide.entries(),
            new PromptContext(input.factPack(), slice.nasSlices())
        );

        var issues = new ArrayList<LintIssue>(guide.issues());
        issues.addAll(slice.issues());
        var lint = PromptLinter.lint(bundle, input.modelSchema(), template);
        for (var warning : lint.warnings()) {
            logger.warn("[{}] {}", warning.check(), warning.message());
        }
        for (var issue : issues) {
            if (issue.isError()) {
                logger.warn("[{}] {}", issue.check(), issue.message());
            }
        }
        logger.debug("Composed bundle {} with {} field guide entries", bundle.id(), guide.entries().size());
        return new CompositionResult(bundle, lint, issues);
    }

    private String bundleId(String templateId, String version) {
        return templateId + "@" + version + "_" + DateTimeFormatter.ISO_INSTANT.format(clock.instant());
    }
}

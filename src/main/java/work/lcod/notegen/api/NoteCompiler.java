package work.lcod.notegen.api;

import com.fasterxml.jackson.core.type.TypeReference;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.notegen.composition.CompositionInput;
import work.lcod.notegen.composition.CompositionResult;
import work.lcod.notegen.composition.LintIssue;
import work.lcod.notegen.composition.PromptComposer;
import work.lcod.notegen.formula.FormulaCache;
import work.lcod.notegen.formula.FormulaEvaluator;
import work.lcod.notegen.resolution.ResolutionEngine;
import work.lcod.notegen.resolution.ResolutionResult;
import work.lcod.notegen.resolution.ResolutionWarning;
import work.lcod.notegen.resolution.ResolverRegistry;
import work.lcod.notegen.schema.SchemaDeriver;
import work.lcod.notegen.schema.SchemaMerger;
import work.lcod.notegen.shared.CanonicalJson;
import work.lcod.notegen.shared.NotegenException;
import work.lcod.notegen.template.TemplateLoader;
import work.lcod.notegen.validation.TemplateLintIssue;
import work.lcod.notegen.validation.TemplateLinter;

/**
 * Public entry point: runs the whole compile pipeline for one template and writes its artifacts.
 */
public final class NoteCompiler {
    public static final String MODEL_SCHEMA_FILE = "model-schema.json";
    public static final String NON_MODEL_SCHEMA_FILE = "non-model-schema.json";
    public static final String RENDER_SCHEMA_FILE = "render-schema.json";
    public static final String SNAPSHOT_FILE = "snapshot.json";
    public static final String PROMPT_BUNDLE_FILE = "prompt-bundle.json";
    public static final String REPORT_FILE = "report.json";

    private static final Logger logger = LoggerFactory.getLogger(NoteCompiler.class);
    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<>() {};

    private final FormulaCache formulaCache;

    public NoteCompiler() {
        this(new FormulaCache());
    }

    public NoteCompiler(FormulaCache formulaCache) {
        this.formulaCache = formulaCache;
    }

    public CompileResult compile(CompileConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("template", configuration.templatePath().toString());
        metadata.put("outputDirectory", configuration.outputDirectory().toString());
        try {
            var settings = configuration.settings();
            var template = TemplateLoader.loadFromFile(configuration.templatePath());
            metadata.put("templateId", template.id());
            metadata.put("templateVersion", template.version());
            logger.info("Compiling template {}@{}", template.id(), template.version());

            var templateLint = TemplateLinter.lint(template);
            metadata.put("templateLint", templateLint.issues().stream().map(TemplateLintIssue::toMap).collect(Collectors.toList()));
            if (!templateLint.ok()) {
                return CompileResult.failure(
                    "Template lint failed with " + templateLint.errors().size() + " error(s)",
                    metadata,
                    started
                );
            }

            var modelSchema = SchemaDeriver.modelFields(settings.schemaBaseUrl()).derive(template);
            var nonModelSchema = SchemaDeriver.nonModelFields(settings.schemaBaseUrl()).derive(template);
            SchemaMerger.validateMergeable(modelSchema, nonModelSchema);
            var renderSchema = new SchemaMerger(settings.schemaBaseUrl())
                .merge(modelSchema, nonModelSchema, template.id(), template.name(), template.version());
            logger.info("Derived schemas: {} model and {} non-model top-level properties",
                modelSchema.properties().size(), nonModelSchema.properties().size());

            var sourceData = readJson(configuration.sourcePath());
            var factPack = configuration.factPackPath().map(NoteCompiler::readJson).orElse(null);

            var evaluator = new FormulaEvaluator(formulaCache);
            var engine = new ResolutionEngine(ResolverRegistry.createDefault(evaluator, settings.verbatimCharsPerSecond()));
            var resolution = engine.build(template, sourceData, nonModelSchema);
            logger.info("Resolved {} non-model fields with {} warnings", resolution.resolved().size(), resolution.warnings().size());

            var clock = configuration.timestamp()
                .map(instant -> Clock.fixed(instant, ZoneOffset.UTC))
                .orElseGet(Clock::systemUTC);
            var composition = new PromptComposer(clock)
                .compose(new CompositionInput(template, modelSchema, resolution.snapshot(), factPack));

            var report = report(resolution, composition);
            var out = configuration.outputDirectory();
            Files.createDirectories(out);
            write(out.resolve(MODEL_SCHEMA_FILE), modelSchema.toJson());
            write(out.resolve(NON_MODEL_SCHEMA_FILE), nonModelSchema.toJson());
            write(out.resolve(RENDER_SCHEMA_FILE), renderSchema.toJson());
            write(out.resolve(SNAPSHOT_FILE), resolution.snapshot());
            write(out.resolve(PROMPT_BUNDLE_FILE), composition.bundle().toMap());
            write(out.resolve(REPORT_FILE), report);
            logger.info("Wrote compile artifacts to {}", out);

            metadata.put("bundleId", composition.bundle().id());
            metadata.put("report", report);
            var blocking = blockingReason(resolution, composition, settings);
            if (blocking != null) {
                return CompileResult.failure(blocking, metadata, started);
            }
            return CompileResult.success(metadata, started);
        } catch (NotegenException ex) {
            metadata.put("code", ex.code());
            return fail(ex, metadata, started);
        } catch (IOException | RuntimeException ex) {
            return fail(ex, metadata, started);
        }
    }

    private static CompileResult fail(Exception ex, Map<String, Object> metadata, Instant started) {
        logger.error("Compilation failed: {}", ex.getMessage());
        if (Boolean.getBoolean("notegen.debug")) {
            logger.error("Stack trace", ex);
        }
        var message = ex.getMessage() == null || ex.getMessage().isBlank()
            ? ex.getClass().getSimpleName()
            : ex.getMessage();
        return CompileResult.failure(message, metadata, started);
    }

    private static String blockingReason(ResolutionResult resolution, CompositionResult composition, CompilerSettings settings) {
        if (resolution.hasErrors()) {
            return "Resolution produced " + resolution.errors().size() + " error(s)";
        }
        if (composition.hasErrors()) {
            return "Prompt composition produced lint errors";
        }
        if (settings.failOnWarnings()) {
            boolean warnings = !resolution.warnings().isEmpty()
                || !composition.lint().warnings().isEmpty()
                || !composition.issues().isEmpty();
            if (warnings) {
                return "Warnings present and lint.fail_on_warnings is enabled";
            }
        }
        return null;
    }

    private static Map<String, Object> report(ResolutionResult resolution, CompositionResult composition) {
        var report = new LinkedHashMap<String, Object>();
        report.put("resolution", resolution.warnings().stream().map(ResolutionWarning::toMap).collect(Collectors.toList()));
        report.put("composition", composition.issues().stream().map(LintIssue::toMap).collect(Collectors.toList()));
        report.put("lint", composition.lint().toMap());
        report.put("fieldCount", Map.of(
            "model", composition.bundle().fieldGuide().size(),
            "resolved", resolution.resolved().size()
        ));
        return report;
    }

    private static Map<String, Object> readJson(Path path) {
        try {
            Map<String, Object> parsed = CanonicalJson.mapper().readValue(path.toFile(), MAP_REF);
            return parsed == null ? new LinkedHashMap<>() : new LinkedHashMap<>(parsed);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid JSON document " + path + ": " + ex.getMessage(), ex);
        }
    }

    private static void write(Path file, Object value) throws IOException {
        Files.writeString(file, CanonicalJson.pretty(value) + "\n");
    }
}

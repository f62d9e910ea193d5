package work.lcod.notegen.cli;

import ch.qos.logback.classic.Level;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.notegen.api.CompileConfiguration;
import work.lcod.notegen.api.LogLevel;
import work.lcod.notegen.api.NoteCompiler;
import work.lcod.notegen.api.SettingsLoader;

@CommandLine.Command(
    name = "notegen",
    description = "Compile a note template into schemas, a resolved snapshot and a prompt bundle.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class NotegenCommand implements Callable<Integer> {
    @CommandLine.Option(
        names = {"-t", "--template"},
        required = true,
        description = "Template file (YAML or JSON)."
    )
    private Path template;

    @CommandLine.Option(
        names = {"-s", "--source"},
        required = true,
        description = "Source data JSON file."
    )
    private Path source;

    @CommandLine.Option(
        names = "--fact-pack",
        description = "Optional fact pack JSON passed to the model as context.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path factPack;

    @CommandLine.Option(
        names = {"-o", "--out"},
        description = "Output directory for generated artifacts.",
        defaultValue = "build/notegen"
    )
    private Path out;

    @CommandLine.Option(
        names = "--config",
        description = "Settings TOML file (default: built-in settings).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--timestamp",
        description = "Fixed ISO-8601 instant used in the bundle id (e.g. 2024-01-01T00:00:00Z).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timestampRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        var logLevel = parseLogLevel();
        applyLogLevel(logLevel);

        var configuration = CompileConfiguration.builder()
            .templatePath(template)
            .sourcePath(source)
            .factPackPath(Optional.ofNullable(factPack))
            .outputDirectory(out)
            .settings(SettingsLoader.load(config))
            .timestamp(parseTimestamp())
            .logLevel(logLevel)
            .build();

        var result = new NoteCompiler().compile(configuration);
        spec.commandLine().getOut().println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private LogLevel parseLogLevel() {
        try {
            return LogLevel.from(logLevelRaw);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private Optional<Instant> parseTimestamp() {
        if (timestampRaw == null || timestampRaw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(timestampRaw.trim()));
        } catch (DateTimeParseException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Invalid --timestamp value: " + timestampRaw);
        }
    }

    private static void applyLogLevel(LogLevel level) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger logback) {
            logback.setLevel(Level.toLevel(level.logbackName(), Level.WARN));
        }
    }
}

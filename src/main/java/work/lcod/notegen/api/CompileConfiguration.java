package work.lcod.notegen.api;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration for a single {@link NoteCompiler} run.
 */
public record CompileConfiguration(
    Path templatePath,
    Path sourcePath,
    Optional<Path> factPackPath,
    Path outputDirectory,
    CompilerSettings settings,
    Optional<Instant> timestamp,
    LogLevel logLevel
) {
    public CompileConfiguration {
        Objects.requireNonNull(templatePath, "templatePath");
        Objects.requireNonNull(sourcePath, "sourcePath");
        Objects.requireNonNull(factPackPath, "factPackPath");
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path templatePath;
        private Path sourcePath;
        private Optional<Path> factPackPath = Optional.empty();
        private Path outputDirectory;
        private CompilerSettings settings = CompilerSettings.defaults();
        private Optional<Instant> timestamp = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder templatePath(Path templatePath) {
            this.templatePath = templatePath;
            return this;
        }

        public Builder sourcePath(Path sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder factPackPath(Optional<Path> factPackPath) {
            this.factPackPath = factPackPath;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public Builder settings(CompilerSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder timestamp(Optional<Instant> timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public CompileConfiguration build() {
            return new CompileConfiguration(
                templatePath,
                sourcePath,
                factPackPath,
                outputDirectory,
                settings,
                timestamp,
                logLevel
            );
        }
    }
}

package work.lcod.notegen.api;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Locale;
import work.lcod.notegen.shared.CanonicalJson;

/**
 * Outcome of a {@link NoteCompiler} run (usable by the CLI and embedding apps).
 */
public record CompileResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    public CompileResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static CompileResult success(Map<String, Object> metadata, Instant startedAt) {
        return new CompileResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static CompileResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new CompileResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        return CanonicalJson.pretty(toSerializableMap());
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}

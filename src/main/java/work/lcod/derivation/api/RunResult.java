package work.lcod.derivation.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one derivation script run: status, process exit code, descriptive metadata and timing.
 */
public record RunResult(Status status, int exitCode, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    /** Exit code of an incomplete derivation when the run required completion. */
    public static final int INCOMPLETE_EXIT_CODE = 2;

    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        Objects.requireNonNull(status, "status");
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult complete(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.COMPLETE, 0, metadata, startedAt, Instant.now());
    }

    /**
     * An incomplete derivation is a normal outcome unless {@code requireComplete} asks for a non-zero exit.
     */
    public static RunResult incomplete(Map<String, Object> metadata, Instant startedAt, boolean requireComplete) {
        int exitCode = requireComplete ? INCOMPLETE_EXIT_CODE : 0;
        return new RunResult(Status.INCOMPLETE, exitCode, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message);
        return new RunResult(Status.FAILURE, 1, meta, startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("exitCode", exitCode);
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Unable to serialize run result", ex);
        }
    }

    public enum Status {
        COMPLETE,
        INCOMPLETE,
        FAILURE
    }
}

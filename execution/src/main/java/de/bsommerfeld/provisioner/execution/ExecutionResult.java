package de.bsommerfeld.provisioner.execution;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one module run. Failures carry a message and, for unexpected
 * exceptions, the cause.
 */
public record ExecutionResult(
        String moduleName,
        boolean success,
        Instant startedAt,
        Instant completedAt,
        double durationSeconds,
        String error,
        Throwable cause,
        Map<String, Object> metadata) {

    public static final String CANCELLED = "cancelled";

    public ExecutionResult {
        Objects.requireNonNull(moduleName, "moduleName");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ExecutionResult succeeded(String moduleName, Instant startedAt, Instant completedAt) {
        return new ExecutionResult(moduleName, true, startedAt, completedAt,
                secondsBetween(startedAt, completedAt), null, null, Map.of());
    }

    public static ExecutionResult failed(String moduleName, Instant startedAt, Instant completedAt,
            String error, Throwable cause) {
        return new ExecutionResult(moduleName, false, startedAt, completedAt,
                secondsBetween(startedAt, completedAt), error, cause, Map.of());
    }

    /** Result for a module that never ran because the session was cancelled. */
    public static ExecutionResult cancelled(String moduleName) {
        Instant now = Instant.now();
        return new ExecutionResult(moduleName, false, now, now, 0.0, CANCELLED, null,
                Map.of(CANCELLED, true));
    }

    public boolean isCancelled() {
        return !success && Boolean.TRUE.equals(metadata.get(CANCELLED));
    }

    static double secondsBetween(Instant start, Instant end) {
        return Duration.between(start, end).toNanos() / 1_000_000_000.0;
    }
}

package de.bsommerfeld.provisioner.execution;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State shared by all strategies for the duration of one installation run:
 * the cancellation flag, the results recorded so far and per-module timing.
 *
 * <p>
 * The flag is lock-free; results and timings are guarded by one lock so a
 * reader never sees a result without its timing.
 */
public class ExecutionSession {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Lock lock = new ReentrantLock();
    private final Map<String, ExecutionResult> results = new LinkedHashMap<>();
    private final Map<String, Instant> startTimes = new LinkedHashMap<>();
    private final Map<String, Instant> endTimes = new LinkedHashMap<>();

    /**
     * Per-module timing as reported by {@link #getExecutionStats()}.
     * {@code end} and {@code durationSeconds} are {@code null} while the
     * module is still running.
     */
    public record ModuleTiming(Instant start, Instant end, Double durationSeconds) {
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void markStarted(String moduleName, Instant at) {
        lock.lock();
        try {
            startTimes.put(moduleName, at);
        } finally {
            lock.unlock();
        }
    }

    void recordResult(ExecutionResult result) {
        lock.lock();
        try {
            results.put(result.moduleName(), result);
            if (startTimes.containsKey(result.moduleName())) {
                endTimes.put(result.moduleName(), result.completedAt());
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<ExecutionResult> getResult(String moduleName) {
        lock.lock();
        try {
            return Optional.ofNullable(results.get(moduleName));
        } finally {
            lock.unlock();
        }
    }

    /** Snapshot of every result recorded so far, in recording order. */
    public Map<String, ExecutionResult> getResults() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(results));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Start, end and duration of every module that actually ran. Modules
     * skipped by cancellation have no entry.
     */
    public Map<String, ModuleTiming> getExecutionStats() {
        lock.lock();
        try {
            Map<String, ModuleTiming> stats = new LinkedHashMap<>();
            startTimes.forEach((module, start) -> {
                Instant end = endTimes.get(module);
                Double duration = end == null ? null : ExecutionResult.secondsBetween(start, end);
                stats.put(module, new ModuleTiming(start, end, duration));
            });
            return Collections.unmodifiableMap(stats);
        } finally {
            lock.unlock();
        }
    }
}

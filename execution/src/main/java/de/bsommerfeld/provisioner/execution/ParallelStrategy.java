package de.bsommerfeld.provisioner.execution;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a batch on a bounded worker pool. The pool holds
 * {@code min(maxWorkers, batch size)} threads and lives for one
 * {@link #execute} call.
 *
 * <p>
 * Results are returned in completion order. When a module fails, modules
 * that have not started yet are withdrawn and receive a cancelled result;
 * modules already running are left to finish.
 */
public class ParallelStrategy implements ExecutionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(ParallelStrategy.class);

    public static final int DEFAULT_MAX_WORKERS = 4;

    private final int maxWorkers;

    public ParallelStrategy() {
        this(DEFAULT_MAX_WORKERS);
    }

    public ParallelStrategy(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
    }

    /** A submitted module. {@code claimed} is won either by the worker or by the canceller. */
    private record Task(ExecutionContext context, AtomicBoolean claimed) {
    }

    @Override
    public Map<String, ExecutionResult> execute(List<ExecutionContext> contexts, ExecutionSession session,
            ProgressCallback callback) {
        Map<String, ExecutionResult> results = new LinkedHashMap<>();
        if (contexts.isEmpty()) {
            return results;
        }

        int workers = Math.min(maxWorkers, contexts.size());
        LOG.info("Executing {} module(s) with {} worker(s)", contexts.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("module-worker-%d")
                .setDaemon(true)
                .build());
        CompletionService<ExecutionResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<ExecutionResult>, Task> pending = new LinkedHashMap<>();

        try {
            for (ExecutionContext context : contexts) {
                Task task = new Task(context, new AtomicBoolean(false));
                pending.put(completion.submit(() -> runClaimed(task, session, callback)), task);
            }

            while (results.size() < contexts.size()) {
                Future<ExecutionResult> future = completion.take();
                Task task = pending.remove(future);
                if (task == null || results.containsKey(task.context().moduleName())) {
                    continue;
                }

                ExecutionResult result = resultOf(future, task, session);
                results.put(result.moduleName(), result);

                if (!result.success() && session.isCancelled()) {
                    withdrawUnstarted(pending, session, results);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for modules, cancelling the remaining ones");
            session.cancel();
            withdrawUnstarted(pending, session, results);
        } finally {
            pool.shutdown();
            awaitQuietly(pool);
        }
        return results;
    }

    private static ExecutionResult runClaimed(Task task, ExecutionSession session, ProgressCallback callback) {
        if (!task.claimed().compareAndSet(false, true)) {
            return null;
        }
        MDC.put("module", task.context().moduleName());
        try {
            return ModuleRunner.run(task.context(), session, callback);
        } finally {
            MDC.remove("module");
        }
    }

    private static ExecutionResult resultOf(Future<ExecutionResult> future, Task task, ExecutionSession session) {
        String module = task.context().moduleName();
        try {
            ExecutionResult result = future.get();
            return result != null ? result : ExecutionResult.cancelled(module);
        } catch (ExecutionException e) {
            // ModuleRunner converts stage exceptions itself; this is an Error or a runner bug
            LOG.error("Worker for {} crashed", module, e.getCause());
            session.cancel();
            Instant now = Instant.now();
            ExecutionResult failed = ExecutionResult.failed(module, now, now, String.valueOf(e.getCause()),
                    e.getCause());
            session.recordResult(failed);
            return failed;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.cancelled(module);
        } catch (CancellationException e) {
            return ExecutionResult.cancelled(module);
        }
    }

    private static void withdrawUnstarted(Map<Future<ExecutionResult>, Task> pending, ExecutionSession session,
            Map<String, ExecutionResult> results) {
        for (Map.Entry<Future<ExecutionResult>, Task> entry : pending.entrySet()) {
            Task task = entry.getValue();
            if (task.claimed().compareAndSet(false, true)) {
                entry.getKey().cancel(false);
                ExecutionResult cancelled = ExecutionResult.cancelled(task.context().moduleName());
                session.recordResult(cancelled);
                results.put(cancelled.moduleName(), cancelled);
                LOG.info("Cancelled {} before it started", cancelled.moduleName());
            }
        }
    }

    private static void awaitQuietly(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    @Override
    public boolean canHandle(List<ExecutionContext> contexts) {
        return contexts.stream().noneMatch(context -> context.hints().prefersPipeline());
    }

    @Override
    public String getName() {
        return "parallel";
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }
}

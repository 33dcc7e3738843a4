package de.bsommerfeld.provisioner.execution;

import de.bsommerfeld.provisioner.core.module.LifecycleStage;
import de.bsommerfeld.provisioner.core.module.ModuleLifecycle;
import de.bsommerfeld.provisioner.core.module.StageContext;
import de.bsommerfeld.provisioner.core.module.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives a single module through its lifecycle. Shared by all strategies so
 * the stage sequence, event reporting and cancellation rules are identical
 * no matter how a module is scheduled.
 */
final class ModuleRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ModuleRunner.class);

    private record Stage(ModuleEvent event, Optional<LifecycleStage> body) {
    }

    private ModuleRunner() {
    }

    /**
     * Runs {@code context} unless the session is already cancelled, records
     * the result in the session and returns it.
     */
    static ExecutionResult run(ExecutionContext context, ExecutionSession session, ProgressCallback callback) {
        String module = context.moduleName();
        if (session.isCancelled()) {
            LOG.info("Skipping {}: installation cancelled", module);
            ExecutionResult cancelled = ExecutionResult.cancelled(module);
            session.recordResult(cancelled);
            return cancelled;
        }

        Instant startedAt = Instant.now();
        session.markStarted(module, startedAt);
        notify(callback, module, ModuleEvent.STARTED, Map.of());

        StageContext stageContext = context.stageContext();
        try {
            for (Stage stage : stagesOf(context.lifecycle())) {
                if (stage.body().isEmpty()) {
                    notify(callback, module, stage.event(), Map.of("skipped", true));
                    continue;
                }
                notify(callback, module, stage.event(), Map.of());
                StageResult result = stage.body().get().run(stageContext);
                if (result == null || !result.success()) {
                    String reason = result == null || result.error() == null
                            ? "Stage '" + stage.event().wireName() + "' failed"
                            : result.error();
                    return fail(module, startedAt, reason, null, session, callback);
                }
            }
        } catch (Exception | Error e) {
            // Errors included: nothing may escape a strategy
            LOG.error("Module {} threw during execution", module, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return fail(module, startedAt, message, e, session, callback);
        }

        ExecutionResult result = ExecutionResult.succeeded(module, startedAt, Instant.now());
        session.recordResult(result);
        notify(callback, module, ModuleEvent.COMPLETED, Map.of("duration", result.durationSeconds()));
        LOG.info("Module {} completed in {}s", module, String.format("%.2f", result.durationSeconds()));
        return result;
    }

    private static ExecutionResult fail(String module, Instant startedAt, String error, Throwable cause,
            ExecutionSession session, ProgressCallback callback) {
        // Flag first so no other worker starts a module after this failure
        session.cancel();
        ExecutionResult result = ExecutionResult.failed(module, startedAt, Instant.now(), error, cause);
        session.recordResult(result);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", error);
        notify(callback, module, ModuleEvent.FAILED, data);
        LOG.error("Module {} failed: {}", module, error);
        return result;
    }

    private static List<Stage> stagesOf(ModuleLifecycle lifecycle) {
        return List.of(
                new Stage(ModuleEvent.VALIDATING, lifecycle.validate()),
                new Stage(ModuleEvent.PRE_CONFIGURE, lifecycle.preConfigure()),
                new Stage(ModuleEvent.CONFIGURING, lifecycle.configure()),
                new Stage(ModuleEvent.POST_CONFIGURE, lifecycle.postConfigure()),
                new Stage(ModuleEvent.VERIFYING, lifecycle.verify()));
    }

    private static void notify(ProgressCallback callback, String module, ModuleEvent event,
            Map<String, Object> data) {
        try {
            callback.onEvent(module, event, data);
        } catch (RuntimeException e) {
            LOG.warn("Progress callback failed for {} ({})", module, event, e);
        }
    }
}

package de.bsommerfeld.provisioner.execution;

import java.util.Map;

/**
 * Receives lifecycle events of executing modules. Called from worker threads
 * when modules run in parallel, so implementations must be thread-safe. An
 * exception thrown here is logged and does not affect the module.
 */
@FunctionalInterface
public interface ProgressCallback {

    ProgressCallback NONE = (module, event, data) -> {
    };

    /**
     * @param data event details: {@code skipped} for absent stages,
     *             {@code duration} on completion, {@code error} on failure
     */
    void onEvent(String moduleName, ModuleEvent event, Map<String, Object> data);
}

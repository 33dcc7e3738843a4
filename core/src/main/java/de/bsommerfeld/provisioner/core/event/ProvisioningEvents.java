package de.bsommerfeld.provisioner.core.event;

import java.util.Map;
import java.util.Set;

/**
 * Events the installer publishes on the {@link ApplicationEventBus}.
 */
public class ProvisioningEvents {

    public record InstallationStartedEvent(String installationId, String profile, boolean resumed) {
    }

    /**
     * One lifecycle transition of a module, mirrored from the execution
     * layer's progress callback.
     *
     * @param event wire name of the stage ({@code started}, {@code configuring},
     *              {@code failed}, ...)
     */
    public record ModuleProgressEvent(String moduleName, String event, Map<String, Object> data) {
    }

    public record BatchStartedEvent(int index, int total, Set<String> modules) {
    }

    public record InstallationFinishedEvent(String installationId, boolean success) {
    }

    /**
     * Fired after an automatic or explicit rollback.
     *
     * @param summary per-type action counts taken before the rollback ran
     */
    public record RollbackFinishedEvent(boolean success, String summary) {
    }
}

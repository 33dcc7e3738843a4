package de.bsommerfeld.provisioner.db;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one installation run.
 *
 * @param installationId {@code inst-} followed by 12 hex characters
 * @param completedAt    {@code null} while the run is in progress
 * @param modules        module states keyed by module name, in first-seen
 *                       order; empty in history listings
 */
public record InstallationState(
        String installationId,
        Instant startedAt,
        String profile,
        InstallationStatus status,
        Instant completedAt,
        Map<String, Object> metadata,
        Map<String, ModuleState> modules) {

    public InstallationState {
        Objects.requireNonNull(installationId, "installationId");
        status = status == null ? InstallationStatus.IN_PROGRESS : status;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        modules = modules == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(modules));
    }

    /** An installation can be resumed while it is in progress and not stamped complete. */
    public boolean isResumable() {
        return status == InstallationStatus.IN_PROGRESS && completedAt == null;
    }

    public InstallationState withModules(Map<String, ModuleState> moduleStates) {
        return new InstallationState(installationId, startedAt, profile, status, completedAt, metadata,
                moduleStates);
    }

    public InstallationState completed(boolean success, Instant at) {
        return new InstallationState(installationId, startedAt, profile,
                success ? InstallationStatus.SUCCESS : InstallationStatus.FAILED, at, metadata, modules);
    }
}

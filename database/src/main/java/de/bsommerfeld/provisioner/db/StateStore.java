package de.bsommerfeld.provisioner.db;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence backend of the {@link StateManager}.
 *
 * <p>
 * All methods throw {@link StateStoreException} when the backend fails. The
 * manager decides which of those failures are fatal.
 */
public interface StateStore {

    void insertInstallation(InstallationState installation);

    /** Inserts or replaces the row keyed by {@code (installationId, module name)}. */
    void upsertModule(String installationId, ModuleState module);

    void insertCheckpoint(CheckpointSnapshot checkpoint);

    void completeInstallation(String installationId, InstallationStatus status, Instant completedAt);

    boolean hasResumableInstallation();

    /**
     * The most recently started resumable installation together with all of
     * its module rows.
     */
    Optional<InstallationState> findResumableInstallation();

    /** Most recent first, without module rows. */
    List<InstallationState> findRecentInstallations(int limit);

    /** Snapshots of one module in insertion order. */
    List<CheckpointSnapshot> findCheckpoints(String installationId, String moduleName);
}

package de.bsommerfeld.provisioner.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks the active installation and its modules so an interrupted run can be
 * detected and resumed.
 *
 * <p>
 * Every mutation is persisted immediately through the {@link StateStore}.
 * Failures are handled by severity: operations that start, resume or finish a
 * run propagate {@link StateStoreException}; progress updates, checkpoints
 * and rollback bookkeeping are logged and dropped so a flaky disk never
 * fails a module.
 *
 * <p>
 * Methods are synchronized; module threads of a parallel batch call in
 * concurrently.
 */
@Singleton
public class StateManager {

    private static final Logger LOG = LoggerFactory.getLogger(StateManager.class);

    static final String ID_PREFIX = "inst-";

    private final StateStore store;
    private final Clock clock;

    private InstallationState current;
    private final Map<String, ModuleState> modules = new LinkedHashMap<>();

    @Inject
    public StateManager(StateStore store) {
        this(store, Clock.systemUTC());
    }

    StateManager(StateStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Allocates a new installation id, persists the row and makes it the
     * active installation.
     *
     * @throws StateStoreException if the row cannot be written
     */
    public synchronized InstallationState startInstallation(String profile, Map<String, Object> metadata) {
        String id = ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        InstallationState installation = new InstallationState(id, now(), profile,
                InstallationStatus.IN_PROGRESS, null, metadata, Map.of());
        store.insertInstallation(installation);

        current = installation;
        modules.clear();
        LOG.info("Started installation {} (profile: {})", id, profile);
        return installation;
    }

    /**
     * Applies the given fields to the module's state, creating it on first
     * reference. {@code null} arguments leave the field unchanged.
     *
     * @param progress percentage, clamped to {@code 0..100}
     * @throws IllegalStateException if no installation is active
     */
    public synchronized void updateModule(String moduleName, ModuleStatus status, Integer progress,
            String currentStep, String error) {
        requireActive();
        ModuleState state = modules.getOrDefault(moduleName, ModuleState.pending(moduleName));

        if (status != null) {
            state = state.withStatus(status, now());
        }
        if (progress != null) {
            state = state.withProgress(progress);
        }
        if (currentStep != null) {
            state = state.withCurrentStep(currentStep);
        }
        if (error != null) {
            state = state.withError(error);
        }

        modules.put(moduleName, state);
        persistModule(state);
        LOG.debug("Updated module {}: {}", moduleName, state.status().value());
    }

    public void updateModule(String moduleName, ModuleStatus status) {
        updateModule(moduleName, status, null, null, null);
    }

    /**
     * Records {@code checkpointName} as the module's latest checkpoint and
     * appends a snapshot of its state. Unknown modules are ignored.
     *
     * @throws IllegalStateException if no installation is active
     */
    public synchronized void createCheckpoint(String moduleName, String checkpointName) {
        requireActive();
        ModuleState state = modules.get(moduleName);
        if (state == null) {
            LOG.warn("Cannot create checkpoint for unknown module: {}", moduleName);
            return;
        }

        state = state.withCheckpoint(checkpointName);
        modules.put(moduleName, state);
        persistModule(state);

        try {
            store.insertCheckpoint(new CheckpointSnapshot(current.installationId(), moduleName, checkpointName,
                    state, now()));
            LOG.info("Created checkpoint '{}' for {}", checkpointName, moduleName);
        } catch (StateStoreException e) {
            LOG.warn("Failed to store checkpoint '{}' for {}", checkpointName, moduleName, e);
        }
    }

    /**
     * Appends an undo action description to the module's persisted state.
     *
     * @throws IllegalStateException if no installation is active
     */
    public synchronized void recordRollbackAction(String moduleName, String description) {
        requireActive();
        ModuleState state = modules.getOrDefault(moduleName, ModuleState.pending(moduleName))
                .withRollbackAction(description);
        modules.put(moduleName, state);
        persistModule(state);
    }

    public synchronized boolean canResume() {
        return store.hasResumableInstallation();
    }

    /**
     * Loads the most recently started resumable installation with all its
     * module rows and makes it the active installation.
     *
     * @return empty if nothing can be resumed
     * @throws StateStoreException if the store cannot be read
     */
    public synchronized Optional<InstallationState> resumeInstallation() {
        Optional<InstallationState> resumable = store.findResumableInstallation();
        resumable.ifPresent(installation -> {
            current = installation.withModules(Map.of());
            modules.clear();
            modules.putAll(installation.modules());
            LOG.info("Resumed installation {} ({} module record(s))", installation.installationId(),
                    installation.modules().size());
        });
        return resumable;
    }

    /**
     * Stamps completion on the active installation.
     *
     * @throws IllegalStateException if no installation is active
     * @throws StateStoreException   if the row cannot be updated
     */
    public synchronized void completeInstallation(boolean success) {
        requireActive();
        InstallationState completed = current.completed(success, now());
        store.completeInstallation(completed.installationId(), completed.status(), completed.completedAt());
        current = completed;
        LOG.info("Installation {} completed with status: {}", completed.installationId(),
                completed.status().value());
    }

    /** Snapshot of the active installation including its module states. */
    public synchronized Optional<InstallationState> getCurrentState() {
        return Optional.ofNullable(current).map(installation -> installation.withModules(modules));
    }

    public synchronized Optional<ModuleState> getModuleState(String moduleName) {
        return Optional.ofNullable(modules.get(moduleName));
    }

    /** Most recent first, without module rows. */
    public List<InstallationState> getInstallationHistory(int limit) {
        return store.findRecentInstallations(limit);
    }

    public List<CheckpointSnapshot> getCheckpoints(String installationId, String moduleName) {
        return store.findCheckpoints(installationId, moduleName);
    }

    private void persistModule(ModuleState state) {
        try {
            store.upsertModule(current.installationId(), state);
        } catch (StateStoreException e) {
            LOG.warn("Failed to persist state of module {}", state.name(), e);
        }
    }

    private void requireActive() {
        if (current == null) {
            throw new IllegalStateException("No active installation");
        }
    }

    // The SQLite store keeps microseconds
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }
}

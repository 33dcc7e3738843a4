package de.bsommerfeld.provisioner.rollback;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.bsommerfeld.provisioner.core.config.RollbackConfig;
import de.bsommerfeld.provisioner.core.module.RollbackLog;
import de.bsommerfeld.provisioner.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered log of undo actions for the changes an installation made.
 *
 * <p>
 * Every registration rewrites the JSON state file in full, so the log
 * survives a crash at any point and {@link #loadState()} can pick it up in
 * the next run. {@link #rollback(boolean)} replays the log in reverse.
 *
 * <h3>Failure handling</h3>
 * A failing undo is collected and the remaining actions are still attempted.
 * After a full success the log and the file are cleared; otherwise the log
 * keeps exactly the actions whose undo failed so a later run can retry them.
 * State file write errors are logged but never fail a registration.
 *
 * <p>
 * Registrations may come from several module threads at once; all public
 * methods are synchronized.
 */
public class RollbackManager implements RollbackLog {

    private static final Logger LOG = LoggerFactory.getLogger(RollbackManager.class);

    public static final String STATE_FILE = "rollback-state.json";

    private final Path stateFile;
    private final CommandRunner runner;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    private final List<RollbackAction> actions = new ArrayList<>();

    /** On-disk layout of the state file. */
    record PersistedState(
            @JsonProperty("actions") List<RollbackAction> actions,
            @JsonProperty("saved_at") Instant savedAt) {
    }

    public RollbackManager(Path stateFile, CommandRunner runner) {
        this(stateFile, runner, Clock.systemUTC());
    }

    RollbackManager(Path stateFile, CommandRunner runner, Clock clock) {
        this.stateFile = stateFile;
        this.runner = runner;
        this.clock = clock;
    }

    /**
     * Resolves the state file from the configured path. A blank path means
     * {@code rollback-state.json} next to the state database.
     */
    public static Path resolveStateFile(RollbackConfig config) {
        String configured = config.getStateFile();
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured);
        }
        return StorageUtils.resolveStateDir(StorageUtils.APP_NAME).resolve(STATE_FILE);
    }

    // =====================================================================
    // Registration
    // =====================================================================

    @Override
    public synchronized void addCommand(String rollbackCommand, String description) {
        append(RollbackAction.command(rollbackCommand, description, clock.instant()));
    }

    @Override
    public synchronized void addFileRestore(String backupPath, String originalPath, String description) {
        append(RollbackAction.fileRestore(backupPath, originalPath, description, clock.instant()));
    }

    @Override
    public synchronized void addPackageRemove(List<String> packages, String description) {
        append(RollbackAction.packageRemove(packages, description, clock.instant()));
    }

    @Override
    public synchronized void addServiceStop(String service, String description) {
        append(RollbackAction.serviceStop(service, description, clock.instant()));
    }

    /**
     * Appends a prebuilt action. Used by decorators that need the action's
     * final description.
     */
    public synchronized void add(RollbackAction action) {
        append(action);
    }

    private void append(RollbackAction action) {
        actions.add(action);
        saveState();
        LOG.debug("Registered rollback action: {}", action.description());
    }

    // =====================================================================
    // Rollback
    // =====================================================================

    /**
     * Undoes every registered action, newest first.
     *
     * @param dryRun only log what would be undone; the log stays untouched
     */
    public synchronized RollbackOutcome rollback(boolean dryRun) {
        if (actions.isEmpty()) {
            LOG.info("No rollback actions to execute");
            return RollbackOutcome.nothingToDo();
        }

        LOG.info("{} {} rollback action(s)...", dryRun ? "Would roll back" : "Rolling back", actions.size());

        // Identity: two registrations of the same undo are distinct entries
        Map<RollbackAction, String> failed = new IdentityHashMap<>();
        List<RollbackAction> reversed = new ArrayList<>(actions);
        Collections.reverse(reversed);
        for (RollbackAction action : reversed) {
            LOG.info("  - {}", action.description());
            if (dryRun) {
                continue;
            }
            try {
                execute(action);
            } catch (RollbackException e) {
                LOG.error("    Failed: {}", e.getMessage());
                failed.put(action, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.error("    Interrupted while undoing: {}", action.description());
                failed.put(action, "interrupted");
            } catch (RuntimeException e) {
                // A malformed action must not keep the older ones from being undone
                LOG.error("    Unexpected error undoing {}", action.description(), e);
                failed.put(action, String.valueOf(e.getMessage() != null ? e.getMessage() : e));
            }
        }

        if (dryRun) {
            return new RollbackOutcome(true, actions.size(), List.of());
        }

        int attempted = actions.size();
        if (!failed.isEmpty()) {
            List<RollbackOutcome.Failure> failures = new ArrayList<>();
            List<RollbackAction> remaining = new ArrayList<>();
            for (RollbackAction action : actions) {
                if (failed.containsKey(action)) {
                    remaining.add(action);
                    failures.add(new RollbackOutcome.Failure(action, failed.get(action)));
                }
            }
            actions.clear();
            actions.addAll(remaining);
            saveState();
            LOG.warn("Rollback completed with {} error(s); {} action(s) kept for retry", failures.size(),
                    remaining.size());
            return new RollbackOutcome(false, attempted, failures);
        }

        actions.clear();
        clearState();
        LOG.info("Rollback completed successfully");
        return new RollbackOutcome(true, attempted, List.of());
    }

    private void execute(RollbackAction action) throws RollbackException, InterruptedException {
        switch (action.actionType()) {
            case COMMAND -> runChecked(action.stringData("command"));
            case FILE_RESTORE -> restoreFile(action.stringData("backup_path"), action.stringData("original_path"));
            case PACKAGE_REMOVE -> runChecked("apt-get remove -y " + String.join(" ", action.packages()));
            case SERVICE_STOP -> stopAndDisable(action.stringData("service"));
        }
    }

    // disable runs even when stop fails
    private void stopAndDisable(String service) throws RollbackException, InterruptedException {
        RollbackException stopFailure = null;
        try {
            runChecked("systemctl stop " + service);
        } catch (RollbackException e) {
            stopFailure = e;
        }
        try {
            runChecked("systemctl disable " + service);
        } catch (RollbackException e) {
            if (stopFailure != null) {
                throw new RollbackException(stopFailure.getMessage() + "; " + e.getMessage(), e);
            }
            throw e;
        }
        if (stopFailure != null) {
            throw stopFailure;
        }
    }

    private void runChecked(String command) throws RollbackException, InterruptedException {
        CommandResult result;
        try {
            result = runner.run(command);
        } catch (IOException e) {
            throw new RollbackException("Could not start '" + command + "': " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new RollbackException(result.timedOut()
                    ? "'" + command + "' timed out"
                    : "'" + command + "' exited with code " + result.exitCode());
        }
    }

    private static void restoreFile(String backupPath, String originalPath) throws RollbackException {
        Path backup = Paths.get(backupPath);
        if (!Files.exists(backup)) {
            throw new RollbackException("Backup not found: " + backupPath);
        }
        try {
            Path original = Paths.get(originalPath);
            Path parent = original.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.copy(backup, original, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new RollbackException("Could not restore " + originalPath + ": " + e.getMessage(), e);
        }
    }

    // =====================================================================
    // Persistence
    // =====================================================================

    /**
     * Replaces the in-memory log with the actions from the state file.
     *
     * @return {@code true} if a state file was found and read
     */
    public synchronized boolean loadState() {
        if (!Files.exists(stateFile)) {
            return false;
        }
        try {
            PersistedState state = mapper.readValue(stateFile.toFile(), PersistedState.class);
            actions.clear();
            if (state.actions() != null) {
                actions.addAll(state.actions());
            }
            LOG.info("Loaded {} rollback action(s) from previous run", actions.size());
            return true;
        } catch (IOException e) {
            LOG.warn("Could not load rollback state from {}: {}", stateFile, e.getMessage());
            return false;
        }
    }

    private void saveState() {
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), new PersistedState(List.copyOf(actions), clock.instant()));
            Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            LOG.warn("Could not save rollback state to {}: {}", stateFile, e.getMessage());
        }
    }

    private void clearState() {
        try {
            Files.deleteIfExists(stateFile);
        } catch (IOException e) {
            LOG.warn("Could not delete rollback state {}: {}", stateFile, e.getMessage());
        }
    }

    // =====================================================================
    // Queries
    // =====================================================================

    /** e.g. {@code "Rollback actions: 2 command, 1 file_restore"}. */
    public synchronized String getSummary() {
        if (actions.isEmpty()) {
            return "No rollback actions pending";
        }
        Map<String, Long> counts = actions.stream()
                .collect(Collectors.groupingBy(action -> action.actionType().value(), LinkedHashMap::new,
                        Collectors.counting()));
        return "Rollback actions: " + counts.entrySet().stream()
                .map(entry -> entry.getValue() + " " + entry.getKey())
                .collect(Collectors.joining(", "));
    }

    public synchronized List<RollbackAction> getActions() {
        return List.copyOf(actions);
    }

    public synchronized boolean hasPendingActions() {
        return !actions.isEmpty();
    }

    public Path getStateFile() {
        return stateFile;
    }
}

package de.bsommerfeld.provisioner.db;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Persisted progress of one module within one installation. Immutable; every
 * {@code with*} method returns an updated copy.
 *
 * @param progressPercent  always within {@code 0..100}
 * @param checkpoint       name of the last checkpoint reached, or {@code null}
 * @param rollbackActions  descriptions of the undo actions the module
 *                         registered, in registration order
 */
public record ModuleState(
        String name,
        ModuleStatus status,
        Instant startedAt,
        Instant completedAt,
        Double durationSeconds,
        int progressPercent,
        String currentStep,
        String errorMessage,
        String checkpoint,
        List<String> rollbackActions) {

    public ModuleState {
        Objects.requireNonNull(name, "name");
        status = status == null ? ModuleStatus.PENDING : status;
        progressPercent = clamp(progressPercent);
        currentStep = currentStep == null ? "" : currentStep;
        rollbackActions = rollbackActions == null ? List.of() : List.copyOf(rollbackActions);
    }

    public static ModuleState pending(String name) {
        return new ModuleState(name, ModuleStatus.PENDING, null, null, null, 0, "", null, null, List.of());
    }

    /**
     * Applies a status transition. The first transition to
     * {@link ModuleStatus#RUNNING} stamps {@code startedAt}; terminal
     * transitions stamp {@code completedAt} and the duration.
     */
    public ModuleState withStatus(ModuleStatus newStatus, Instant now) {
        Instant started = startedAt;
        Instant completed = completedAt;
        Double duration = durationSeconds;
        if (newStatus == ModuleStatus.RUNNING && started == null) {
            started = now;
        } else if (newStatus.isTerminal()) {
            completed = now;
            if (started != null) {
                duration = Duration.between(started, now).toMillis() / 1000.0;
            }
        }
        return new ModuleState(name, newStatus, started, completed, duration, progressPercent, currentStep,
                errorMessage, checkpoint, rollbackActions);
    }

    public ModuleState withProgress(int percent) {
        return new ModuleState(name, status, startedAt, completedAt, durationSeconds, percent, currentStep,
                errorMessage, checkpoint, rollbackActions);
    }

    public ModuleState withCurrentStep(String step) {
        return new ModuleState(name, status, startedAt, completedAt, durationSeconds, progressPercent, step,
                errorMessage, checkpoint, rollbackActions);
    }

    public ModuleState withError(String error) {
        return new ModuleState(name, status, startedAt, completedAt, durationSeconds, progressPercent,
                currentStep, error, checkpoint, rollbackActions);
    }

    public ModuleState withCheckpoint(String checkpointName) {
        return new ModuleState(name, status, startedAt, completedAt, durationSeconds, progressPercent,
                currentStep, errorMessage, checkpointName, rollbackActions);
    }

    public ModuleState withRollbackAction(String description) {
        List<String> actions = new ArrayList<>(rollbackActions);
        actions.add(description);
        return new ModuleState(name, status, startedAt, completedAt, durationSeconds, progressPercent,
                currentStep, errorMessage, checkpoint, actions);
    }

    private static int clamp(int percent) {
        return Math.min(100, Math.max(0, percent));
    }
}

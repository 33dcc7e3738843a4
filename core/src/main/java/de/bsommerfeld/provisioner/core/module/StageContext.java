package de.bsommerfeld.provisioner.core.module;

import java.util.Map;

/**
 * Everything a lifecycle stage gets to see about the run it belongs to.
 *
 * @param moduleName  name of the executing module
 * @param config      module-specific configuration, never {@code null}
 * @param dryRun      {@code true} if the stage must not mutate the system
 * @param rollback    where the stage registers undo actions for the changes
 *                    it makes
 * @param checkpoints records named progress markers for the module
 */
public record StageContext(
        String moduleName,
        Map<String, Object> config,
        boolean dryRun,
        RollbackLog rollback,
        CheckpointRecorder checkpoints) {

    public StageContext {
        config = config == null ? Map.of() : Map.copyOf(config);
        rollback = rollback == null ? RollbackLog.NONE : rollback;
        checkpoints = checkpoints == null ? CheckpointRecorder.NONE : checkpoints;
    }
}

package de.bsommerfeld.provisioner.execution;

import de.bsommerfeld.provisioner.core.module.CheckpointRecorder;
import de.bsommerfeld.provisioner.core.module.ModuleDescriptor;
import de.bsommerfeld.provisioner.core.module.ModuleLifecycle;
import de.bsommerfeld.provisioner.core.module.RollbackLog;
import de.bsommerfeld.provisioner.core.module.SchedulingHints;
import de.bsommerfeld.provisioner.core.module.StageContext;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a strategy needs to run one module.
 *
 * @param moduleName   module name, unique within a run
 * @param lifecycle    the module's stage table
 * @param config       module-specific configuration
 * @param dryRun       stages must not mutate the system
 * @param dependencies names of the modules this one depends on
 * @param hints        routing hints for {@link HybridStrategy}
 * @param rollback     where stages register undo actions
 * @param checkpoints  where stages record named checkpoints
 */
public record ExecutionContext(
        String moduleName,
        ModuleLifecycle lifecycle,
        Map<String, Object> config,
        boolean dryRun,
        Set<String> dependencies,
        SchedulingHints hints,
        RollbackLog rollback,
        CheckpointRecorder checkpoints) {

    public ExecutionContext {
        Objects.requireNonNull(moduleName, "moduleName");
        lifecycle = lifecycle == null ? ModuleLifecycle.empty() : lifecycle;
        config = config == null ? Map.of() : Map.copyOf(config);
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        hints = hints == null ? SchedulingHints.DEFAULT : hints;
        rollback = rollback == null ? RollbackLog.NONE : rollback;
        checkpoints = checkpoints == null ? CheckpointRecorder.NONE : checkpoints;
    }

    public static ExecutionContext of(ModuleDescriptor descriptor, Map<String, Object> config, boolean dryRun) {
        return new ExecutionContext(descriptor.name(), descriptor.lifecycle(), config, dryRun,
                descriptor.dependsOn(), descriptor.hints(), null, null);
    }

    public ExecutionContext withRollback(RollbackLog rollbackLog) {
        return new ExecutionContext(moduleName, lifecycle, config, dryRun, dependencies, hints, rollbackLog,
                checkpoints);
    }

    public ExecutionContext withCheckpoints(CheckpointRecorder recorder) {
        return new ExecutionContext(moduleName, lifecycle, config, dryRun, dependencies, hints, rollback,
                recorder);
    }

    /** The view handed to each lifecycle stage. */
    public StageContext stageContext() {
        return new StageContext(moduleName, config, dryRun, rollback, checkpoints);
    }
}

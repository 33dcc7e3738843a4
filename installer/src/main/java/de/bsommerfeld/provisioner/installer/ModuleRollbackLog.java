package de.bsommerfeld.provisioner.installer;

import de.bsommerfeld.provisioner.core.module.RollbackLog;
import de.bsommerfeld.provisioner.db.StateManager;
import de.bsommerfeld.provisioner.rollback.RollbackAction;
import de.bsommerfeld.provisioner.rollback.RollbackManager;

import java.time.Instant;
import java.util.List;

/**
 * The {@link RollbackLog} handed to one module. Registrations go to the
 * shared {@link RollbackManager} and their descriptions are also appended to
 * the module's persisted state, so the state database shows what each module
 * would undo.
 */
final class ModuleRollbackLog implements RollbackLog {

    private final String moduleName;
    private final RollbackManager rollbackManager;
    private final StateManager stateManager;

    ModuleRollbackLog(String moduleName, RollbackManager rollbackManager, StateManager stateManager) {
        this.moduleName = moduleName;
        this.rollbackManager = rollbackManager;
        this.stateManager = stateManager;
    }

    @Override
    public void addCommand(String rollbackCommand, String description) {
        record(RollbackAction.command(rollbackCommand, description, Instant.now()));
    }

    @Override
    public void addFileRestore(String backupPath, String originalPath, String description) {
        record(RollbackAction.fileRestore(backupPath, originalPath, description, Instant.now()));
    }

    @Override
    public void addPackageRemove(List<String> packages, String description) {
        record(RollbackAction.packageRemove(packages, description, Instant.now()));
    }

    @Override
    public void addServiceStop(String service, String description) {
        record(RollbackAction.serviceStop(service, description, Instant.now()));
    }

    private void record(RollbackAction action) {
        rollbackManager.add(action);
        stateManager.recordRollbackAction(moduleName, action.description());
    }
}

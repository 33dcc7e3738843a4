package de.bsommerfeld.provisioner.core.module;

import java.util.List;

/**
 * Registration side of the rollback log. Modules call these methods right
 * after performing the change the action undoes.
 */
public interface RollbackLog {

    /** Discards every registration. Used when no rollback log is wired. */
    RollbackLog NONE = new RollbackLog() {
        @Override
        public void addCommand(String rollbackCommand, String description) {
        }

        @Override
        public void addFileRestore(String backupPath, String originalPath, String description) {
        }

        @Override
        public void addPackageRemove(List<String> packages, String description) {
        }

        @Override
        public void addServiceStop(String service, String description) {
        }
    };

    /**
     * @param rollbackCommand shell command that undoes the change
     * @param description     human-readable description, may be empty
     */
    void addCommand(String rollbackCommand, String description);

    void addFileRestore(String backupPath, String originalPath, String description);

    void addPackageRemove(List<String> packages, String description);

    void addServiceStop(String service, String description);

    default void addCommand(String rollbackCommand) {
        addCommand(rollbackCommand, "");
    }

    default void addFileRestore(String backupPath, String originalPath) {
        addFileRestore(backupPath, originalPath, "");
    }

    default void addPackageRemove(List<String> packages) {
        addPackageRemove(packages, "");
    }

    default void addServiceStop(String service) {
        addServiceStop(service, "");
    }
}

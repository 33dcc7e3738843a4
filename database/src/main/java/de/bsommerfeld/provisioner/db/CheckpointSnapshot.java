package de.bsommerfeld.provisioner.db;

import java.time.Instant;

/**
 * Append-only record of a module's state at a named checkpoint.
 */
public record CheckpointSnapshot(
        String installationId,
        String moduleName,
        String checkpointName,
        ModuleState snapshot,
        Instant createdAt) {
}

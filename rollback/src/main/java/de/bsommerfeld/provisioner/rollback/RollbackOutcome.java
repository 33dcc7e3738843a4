package de.bsommerfeld.provisioner.rollback;

import java.util.List;

/**
 * Result of {@link RollbackManager#rollback(boolean)}.
 *
 * @param attempted number of actions whose undo was attempted (or listed, on
 *                  a dry run)
 * @param failures  actions whose undo failed, in original registration order
 */
public record RollbackOutcome(boolean success, int attempted, List<Failure> failures) {

    public record Failure(RollbackAction action, String reason) {
    }

    public RollbackOutcome {
        failures = List.copyOf(failures);
    }

    static RollbackOutcome nothingToDo() {
        return new RollbackOutcome(true, 0, List.of());
    }
}

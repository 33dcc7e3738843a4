package de.bsommerfeld.provisioner.rollback;

/**
 * Thrown when a single rollback action cannot be undone.
 */
public class RollbackException extends Exception {

    public RollbackException(String message) {
        super(message);
    }

    public RollbackException(String message, Throwable cause) {
        super(message, cause);
    }
}

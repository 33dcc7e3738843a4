package de.bsommerfeld.provisioner.db;

/**
 * A state store could not read or write installation state. Wraps the
 * underlying {@link java.sql.SQLException} or serialization failure.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

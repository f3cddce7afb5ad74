package io.easyrepo;

/**
 * Thrown when the persistence engine rejects a staged change or fails to persist it.
 */
public class PersistenceException extends UnitOfWorkException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}

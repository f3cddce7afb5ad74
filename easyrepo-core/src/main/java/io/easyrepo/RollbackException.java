package io.easyrepo;

/**
 * Thrown when the persistence engine fails to roll back the open transaction.
 */
public final class RollbackException extends UnitOfWorkException {

    public RollbackException(Throwable cause) {
        super("Failed to roll back transaction: " + cause.getMessage(), cause);
    }
}

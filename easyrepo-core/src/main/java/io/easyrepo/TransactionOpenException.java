package io.easyrepo;

/**
 * Thrown when the persistence engine refuses to begin a transaction.
 */
public final class TransactionOpenException extends UnitOfWorkException {

    public TransactionOpenException(Throwable cause) {
        super("Failed to begin transaction: " + cause.getMessage(), cause);
    }
}

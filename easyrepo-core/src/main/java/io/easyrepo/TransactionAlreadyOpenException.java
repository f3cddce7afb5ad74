package io.easyrepo;

/**
 * Thrown by {@link UnitOfWork#beginTransaction()} while a transaction is already open.
 */
public final class TransactionAlreadyOpenException extends InvalidStateException {

    public TransactionAlreadyOpenException() {
        super("There is already an open transaction");
    }
}

package io.easyrepo;

/**
 * Thrown by {@link UnitOfWork#commitTransaction()} when no transaction is open.
 */
public final class NoActiveTransactionException extends UnitOfWorkException {

    public NoActiveTransactionException() {
        super("There is no current transaction");
    }
}

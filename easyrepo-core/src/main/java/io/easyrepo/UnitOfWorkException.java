package io.easyrepo;

/**
 * Base type of every failure surfaced by a {@link UnitOfWork} or its {@link Repository}.
 *
 * <p>Engine failures are always chained as the cause, never discarded.
 */
public class UnitOfWorkException extends RuntimeException {

    public UnitOfWorkException(String message) {
        super(message);
    }

    public UnitOfWorkException(String message, Throwable cause) {
        super(message, cause);
    }
}

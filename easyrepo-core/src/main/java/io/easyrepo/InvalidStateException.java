package io.easyrepo;

/**
 * Thrown when an operation is invoked on a unit of work whose persistence context
 * has been closed, or whose transaction state does not allow the operation.
 *
 * <p>Not retryable on the same {@link UnitOfWork} instance.
 */
public class InvalidStateException extends UnitOfWorkException {

    public InvalidStateException(String message) {
        super(message);
    }
}

package io.easyrepo;

/**
 * Groups repository operations into one transaction against a single persistence context.
 *
 * <p>Typical use:
 * <pre>{@code
 * try (UnitOfWork<Long> uow = factory.create()) {
 *     uow.beginTransaction();
 *     uow.repository().add(customer);
 *     uow.commitTransaction();
 * }
 * }</pre>
 *
 * <p>At most one transaction is open at a time. After {@link #close()} every
 * operation, including those of {@link #repository()}, fails with
 * {@link InvalidStateException}. Instances are not thread-safe.
 *
 * @param <K> identifier type of the repository
 */
public interface UnitOfWork<K> extends AutoCloseable {

    /**
     * The repository bound to this unit of work. The same instance is returned for its lifetime.
     */
    Repository<K> repository();

    /**
     * Returns {@code true} while a transaction is open.
     */
    boolean isTransactionActive();

    /**
     * Opens a transaction.
     *
     * @throws InvalidStateException           if this unit of work is closed
     * @throws TransactionAlreadyOpenException if a transaction is already open
     * @throws TransactionOpenException        if the store refuses to begin
     */
    void beginTransaction();

    /**
     * Flushes staged changes and commits the open transaction. On failure the
     * transaction is rolled back before the error is thrown. The transaction is
     * closed on every path.
     *
     * @throws InvalidStateException        if this unit of work is closed
     * @throws NoActiveTransactionException if no transaction is open
     * @throws ValidationFailedException    if staged entities are invalid
     * @throws PersistenceException         if the store fails to flush or commit
     */
    void commitTransaction();

    /**
     * Like {@link #commitTransaction()}, but reports validation and store failures
     * as a {@link CommitResult} instead of throwing them.
     *
     * @throws InvalidStateException        if this unit of work is closed
     * @throws NoActiveTransactionException if no transaction is open
     */
    CommitResult tryCommit();

    /**
     * Rolls back and closes the open transaction. Does nothing if none is open.
     *
     * @throws InvalidStateException if this unit of work is closed
     * @throws RollbackException     if the store fails to roll back
     */
    void rollbackTransaction();

    /**
     * Releases the persistence context. Failures while releasing are logged, never thrown.
     */
    @Override
    void close();
}

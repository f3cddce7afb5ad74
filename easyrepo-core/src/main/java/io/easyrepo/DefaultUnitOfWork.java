package io.easyrepo;

import io.easyrepo.spi.EntityValidationException;
import io.easyrepo.spi.PersistenceContext;
import io.easyrepo.spi.TransactionHandle;
import io.easyrepo.spi.UnitOfWorkMetrics;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link UnitOfWork} over a {@link PersistenceContext} it owns.
 *
 * <p>Transaction state is a single nullable {@link TransactionHandle}: non-null
 * exactly while a transaction is open. Commit and rollback always clear and
 * close the handle, whatever their outcome. A failed commit is compensated by
 * a rollback before the error reaches the caller.
 *
 * <p>The {@link GenericRepository} created here is guarded by {@link #ensureContext()},
 * so repository calls fail once this unit of work is closed.
 *
 * @param <K> identifier type of the repository
 */
public final class DefaultUnitOfWork<K> implements UnitOfWork<K> {
    private static final Logger logger = Logger.getLogger(DefaultUnitOfWork.class.getName());

    private final Repository<K> repository;
    private final UnitOfWorkMetrics metrics;
    private PersistenceContext context;
    private TransactionHandle transaction;

    public DefaultUnitOfWork(PersistenceContext context) {
        this(context, UnitOfWorkMetrics.NOOP);
    }

    public DefaultUnitOfWork(PersistenceContext context, UnitOfWorkMetrics metrics) {
        this.context = Objects.requireNonNull(context, "context");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.repository = new GenericRepository<>(context, this::ensureContext);
    }

    @Override
    public Repository<K> repository() {
        return repository;
    }

    @Override
    public boolean isTransactionActive() {
        return transaction != null;
    }

    @Override
    public void beginTransaction() {
        ensureContext();
        if (transaction != null) {
            throw new TransactionAlreadyOpenException();
        }
        try {
            transaction = context.beginTransaction();
        } catch (RuntimeException e) {
            throw new TransactionOpenException(e);
        }
        metrics.incrementTransactionsBegun();
        logger.fine("Transaction opened");
    }

    @Override
    public void commitTransaction() {
        ensureContext();
        if (transaction == null) {
            throw new NoActiveTransactionException();
        }
        try {
            context.saveChanges();
            transaction.commit();
            metrics.incrementCommits();
            logger.fine("Transaction committed");
        } catch (EntityValidationException e) {
            metrics.incrementValidationFailures();
            ValidationFailedException failure = new ValidationFailedException(e);
            compensate(failure);
            throw failure;
        } catch (RuntimeException e) {
            metrics.incrementCommitFailures();
            PersistenceException failure = new PersistenceException("Failed to commit transaction: " + e.getMessage(), e);
            compensate(failure);
            throw failure;
        } finally {
            TransactionHandle handle = transaction;
            transaction = null;
            if (handle != null) {
                closeHandle(handle);
            }
        }
    }

    @Override
    public CommitResult tryCommit() {
        try {
            commitTransaction();
            return CommitResult.COMMITTED;
        } catch (ValidationFailedException e) {
            return new CommitResult.ValidationFailed(e.results(), e.getMessage());
        } catch (PersistenceException e) {
            return new CommitResult.Failed(e);
        }
    }

    @Override
    public void rollbackTransaction() {
        ensureContext();
        TransactionHandle handle = transaction;
        if (handle == null) {
            return;
        }
        transaction = null;
        try {
            handle.rollback();
            metrics.incrementRollbacks();
            logger.fine("Transaction rolled back");
        } catch (RuntimeException e) {
            throw new RollbackException(e);
        } finally {
            closeHandle(handle);
        }
    }

    @Override
    public void close() {
        PersistenceContext current = context;
        if (current == null) {
            return;
        }
        context = null;
        try {
            current.close();
        } catch (RuntimeException e) {
            metrics.incrementCloseFailures();
            logger.log(Level.WARNING, "Failed to close persistence context", e);
        }
    }

    private void ensureContext() {
        if (context == null) {
            throw new InvalidStateException("The persistence context is closed and unusable");
        }
    }

    private void compensate(UnitOfWorkException failure) {
        try {
            rollbackTransaction();
        } catch (RollbackException e) {
            logger.log(Level.WARNING, "Rollback after failed commit did not complete", e);
            failure.addSuppressed(e);
        }
    }

    private static void closeHandle(TransactionHandle handle) {
        try {
            handle.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to release transaction", e);
        }
    }
}

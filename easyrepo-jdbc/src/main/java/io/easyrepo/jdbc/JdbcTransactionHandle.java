package io.easyrepo.jdbc;

import io.easyrepo.spi.TransactionHandle;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction on the connection of a {@link JdbcPersistenceContext}. Auto-commit is
 * disabled for its lifetime and restored when it completes.
 *
 * <p>A failed commit leaves the handle open so that the caller can roll it back.
 * Rolling back also discards the context's staged changes and clears the ids
 * generated for rows inserted during the transaction. {@link #close()} rolls
 * back a handle that was never completed.
 */
final class JdbcTransactionHandle implements TransactionHandle {
    private static final Logger logger = Logger.getLogger(JdbcTransactionHandle.class.getName());

    private final JdbcPersistenceContext context;
    private final Connection connection;
    private boolean completed;

    JdbcTransactionHandle(JdbcPersistenceContext context, Connection connection) {
        this.context = context;
        this.connection = connection;
    }

    @Override
    public void commit() {
        if (completed) {
            return;
        }
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new DataStoreException("Failed to commit transaction: " + e.getMessage(), e);
        }
        finish();
    }

    @Override
    public void rollback() {
        if (completed) {
            return;
        }
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new DataStoreException("Failed to roll back transaction: " + e.getMessage(), e);
        } finally {
            context.discardChanges();
            finish();
        }
    }

    @Override
    public void close() {
        if (!completed) {
            rollback();
        }
    }

    private void finish() {
        completed = true;
        context.transactionEnded(this);
        try {
            if (!connection.isClosed()) {
                connection.setAutoCommit(true);
            }
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to restore auto-commit", e);
        }
    }
}

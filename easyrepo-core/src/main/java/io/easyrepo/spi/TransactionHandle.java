package io.easyrepo.spi;

/**
 * An open transaction on a {@link PersistenceContext}.
 *
 * <p>{@link #close()} releases the handle; closing a handle that was neither
 * committed nor rolled back rolls it back.
 */
public interface TransactionHandle extends AutoCloseable {

    void commit();

    void rollback();

    @Override
    void close();
}

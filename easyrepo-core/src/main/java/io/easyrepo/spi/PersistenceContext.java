package io.easyrepo.spi;

import io.easyrepo.Include;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Session with the underlying store through which a {@link io.easyrepo.UnitOfWork}
 * and its repository read entities and stage changes.
 *
 * <p>Staged inserts, updates and removals are held in memory until
 * {@link #saveChanges()} flushes them. Implementations are not thread-safe;
 * a context is owned by exactly one unit of work.
 *
 * <p>Failures are reported as unchecked exceptions. A validation failure during
 * {@link #saveChanges()} must be reported as {@link EntityValidationException}
 * so callers can distinguish it from other store errors.
 *
 * @see TransactionHandle
 */
public interface PersistenceContext extends AutoCloseable {

    /**
     * Looks up an entity by identifier, consulting staged changes first.
     *
     * @return the entity, or empty if none exists or its removal is staged
     */
    <T> Optional<T> find(Class<T> type, Object id);

    /**
     * Lists entities of a type that match the filter, eager-loading the given includes.
     *
     * @param includes related properties to load; empty means no related data is loaded
     */
    <T> List<T> list(Class<T> type, Predicate<? super T> filter, List<Include<T>> includes);

    /**
     * Stages an entity for insertion.
     */
    void stageInsert(Object entity);

    /**
     * Stages an entity as fully modified; every mapped field is written on flush.
     */
    void stageUpdate(Object entity);

    /**
     * Stages an entity for removal.
     */
    void stageRemoval(Object entity);

    /**
     * Opens a transaction on this context.
     *
     * @return handle of the new transaction
     */
    TransactionHandle beginTransaction();

    /**
     * Flushes every staged change to the store.
     *
     * @return number of entities written
     * @throws EntityValidationException if one or more staged entities are invalid
     */
    int saveChanges();

    /**
     * Releases the session. An open transaction is rolled back.
     */
    @Override
    void close();
}

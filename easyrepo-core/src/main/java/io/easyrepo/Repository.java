package io.easyrepo;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Typed CRUD access to persisted entities.
 *
 * <p>Every operation first verifies that the owning {@link UnitOfWork} is still
 * usable and fails with {@link InvalidStateException} otherwise, before the
 * store is touched. {@link #add}, {@link #update} and {@link #delete} only stage
 * changes; they are written when the unit of work commits.
 *
 * @param <K> identifier type used to address entities
 */
public interface Repository<K> {

    /**
     * Finds the entity with the given identifier.
     *
     * @return the entity, or empty if none exists
     * @throws PersistenceException if the store cannot be read
     */
    <T> Optional<T> findById(Class<T> type, K id);

    /**
     * Returns all entities of a type, in the order the store yields them.
     */
    <T> List<T> getList(Class<T> type);

    /**
     * Returns the entities of a type that match the filter.
     */
    <T> List<T> getList(Class<T> type, Predicate<? super T> filter);

    /**
     * Returns the entities of a type that match the filter, eager-loading each
     * include for every returned entity. Without includes this behaves exactly
     * like {@link #getList(Class, Predicate)}.
     *
     * @throws PersistenceException if the store cannot be read or an include is unknown
     */
    <T> List<T> getListIncluding(Class<T> type, Predicate<? super T> filter, Include<T>... includes);

    /**
     * Stages an entity for insertion.
     *
     * @return the same entity
     * @throws PersistenceException if the store rejects the entity
     */
    <T> T add(T entity);

    /**
     * Stages an entity as fully modified.
     *
     * @return the same entity
     * @throws PersistenceException if the store rejects the entity
     */
    <T> T update(T entity);

    /**
     * Looks up the entity with the given identifier and stages its removal.
     *
     * @throws EntityNotFoundException if no entity exists for {@code id}
     * @throws PersistenceException    if the store rejects the removal
     */
    <T> void delete(Class<T> type, K id);
}

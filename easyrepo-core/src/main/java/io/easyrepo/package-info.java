/**
 * Unit of work and repository API.
 *
 * <p>{@link io.easyrepo.UnitOfWork} owns a persistence context and its transaction;
 * {@link io.easyrepo.Repository} offers typed CRUD over the same context. Failures
 * extend {@link io.easyrepo.UnitOfWorkException}.
 *
 * @see io.easyrepo.DefaultUnitOfWork
 * @see io.easyrepo.GenericRepository
 * @see io.easyrepo.spi.PersistenceContext
 */
package io.easyrepo;

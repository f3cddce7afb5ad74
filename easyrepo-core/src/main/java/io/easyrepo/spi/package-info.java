/**
 * Service provider interfaces implemented by persistence engines.
 *
 * <p>{@link io.easyrepo.spi.PersistenceContext} and
 * {@link io.easyrepo.spi.TransactionHandle} are the only collaborators a
 * {@link io.easyrepo.UnitOfWork} talks to. {@link io.easyrepo.spi.UnitOfWorkMetrics}
 * bridges lifecycle counters to a monitoring system.
 */
package io.easyrepo.spi;

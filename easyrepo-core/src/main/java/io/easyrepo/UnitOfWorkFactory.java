package io.easyrepo;

/**
 * Creates independent {@link UnitOfWork} instances, each with its own persistence context.
 *
 * @param <K> identifier type of the created repositories
 */
@FunctionalInterface
public interface UnitOfWorkFactory<K> {

    UnitOfWork<K> create();
}

package io.easyrepo;

/**
 * Check a {@link Repository} runs before every operation, supplied by the
 * owner of the persistence context.
 */
@FunctionalInterface
public interface ContextGuard {

    /**
     * Returns normally if the persistence context can be used.
     *
     * @throws InvalidStateException if the context has been released
     */
    void ensureUsable();
}

package io.easyrepo.spi;

/**
 * Observability hook for exporting unit-of-work counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface UnitOfWorkMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    UnitOfWorkMetrics NOOP = new Noop();

    /**
     * Increments the count of transactions opened.
     */
    void incrementTransactionsBegun();

    /**
     * Increments the count of transactions committed successfully.
     */
    void incrementCommits();

    /**
     * Increments the count of commits that failed for a reason other than validation.
     */
    void incrementCommitFailures();

    /**
     * Increments the count of commits rejected because staged entities were invalid.
     */
    void incrementValidationFailures();

    /**
     * Increments the count of transactions rolled back, including compensating rollbacks.
     */
    void incrementRollbacks();

    /**
     * Increments the count of persistence contexts that failed to close cleanly.
     */
    void incrementCloseFailures();

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements UnitOfWorkMetrics {
        @Override
        public void incrementTransactionsBegun() {
        }

        @Override
        public void incrementCommits() {
        }

        @Override
        public void incrementCommitFailures() {
        }

        @Override
        public void incrementValidationFailures() {
        }

        @Override
        public void incrementRollbacks() {
        }

        @Override
        public void incrementCloseFailures() {
        }
    }
}

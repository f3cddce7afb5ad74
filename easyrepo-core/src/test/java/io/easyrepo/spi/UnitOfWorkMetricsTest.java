package io.easyrepo.spi;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class UnitOfWorkMetricsTest {

    @Test
    void noopAcceptsEveryCounter() {
        UnitOfWorkMetrics metrics = UnitOfWorkMetrics.NOOP;

        assertInstanceOf(UnitOfWorkMetrics.Noop.class, metrics);
        assertDoesNotThrow(() -> {
            metrics.incrementTransactionsBegun();
            metrics.incrementCommits();
            metrics.incrementCommitFailures();
            metrics.incrementValidationFailures();
            metrics.incrementRollbacks();
            metrics.incrementCloseFailures();
        });
    }
}

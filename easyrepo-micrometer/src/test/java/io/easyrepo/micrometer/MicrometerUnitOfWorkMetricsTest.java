package io.easyrepo.micrometer;

import io.easyrepo.DefaultUnitOfWork;
import io.easyrepo.Include;
import io.easyrepo.PersistenceException;
import io.easyrepo.UnitOfWork;
import io.easyrepo.spi.PersistenceContext;
import io.easyrepo.spi.TransactionHandle;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MicrometerUnitOfWorkMetricsTest {

    private SimpleMeterRegistry registry;
    private MicrometerUnitOfWorkMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerUnitOfWorkMetrics(registry);
    }

    @Test
    void incrementTransactionsBegun() {
        metrics.incrementTransactionsBegun();
        metrics.incrementTransactionsBegun();
        assertEquals(2.0, counter("easyrepo.transaction.begin").count());
    }

    @Test
    void incrementCommits() {
        metrics.incrementCommits();
        assertEquals(1.0, counter("easyrepo.transaction.commit").count());
    }

    @Test
    void incrementCommitFailures() {
        metrics.incrementCommitFailures();
        assertEquals(1.0, counter("easyrepo.transaction.commit.failure").count());
    }

    @Test
    void incrementValidationFailures() {
        metrics.incrementValidationFailures();
        assertEquals(1.0, counter("easyrepo.transaction.validation.failure").count());
    }

    @Test
    void incrementRollbacks() {
        metrics.incrementRollbacks();
        metrics.incrementRollbacks();
        metrics.incrementRollbacks();
        assertEquals(3.0, counter("easyrepo.transaction.rollback").count());
    }

    @Test
    void incrementCloseFailures() {
        metrics.incrementCloseFailures();
        assertEquals(1.0, counter("easyrepo.context.close.failure").count());
    }

    @Test
    void customNamePrefix() {
        var custom = new MicrometerUnitOfWorkMetrics(registry, "orders.repo");
        custom.incrementCommits();

        assertEquals(1.0, counter("orders.repo.transaction.commit").count());
    }

    @Test
    void invalidArgumentsThrow() {
        assertThrows(NullPointerException.class, () -> new MicrometerUnitOfWorkMetrics(null));
        assertThrows(NullPointerException.class, () -> new MicrometerUnitOfWorkMetrics(registry, null));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerUnitOfWorkMetrics(registry, ""));
        assertThrows(IllegalArgumentException.class, () -> new MicrometerUnitOfWorkMetrics(registry, "repo."));
    }

    @Test
    void closeRemovesMetersAndIgnoresLaterIncrements() {
        metrics.close();
        metrics.incrementCommits();

        assertNull(registry.find("easyrepo.transaction.commit").counter());
    }

    @Test
    void countsUnitOfWorkLifecycle() {
        StubContext context = new StubContext();
        try (UnitOfWork<Long> uow = new DefaultUnitOfWork<>(context, metrics)) {
            uow.beginTransaction();
            uow.commitTransaction();

            uow.beginTransaction();
            uow.rollbackTransaction();

            context.failSave = true;
            uow.beginTransaction();
            assertThrows(PersistenceException.class, uow::commitTransaction);
        }

        assertEquals(3.0, counter("easyrepo.transaction.begin").count());
        assertEquals(1.0, counter("easyrepo.transaction.commit").count());
        assertEquals(1.0, counter("easyrepo.transaction.commit.failure").count());
        assertEquals(2.0, counter("easyrepo.transaction.rollback").count());
    }

    private Counter counter(String name) {
        Counter c = registry.find(name).counter();
        assertNotNull(c, "Counter not found: " + name);
        return c;
    }

    private static final class StubContext implements PersistenceContext {
        boolean failSave;

        @Override
        public <T> Optional<T> find(Class<T> type, Object id) {
            return Optional.empty();
        }

        @Override
        public <T> List<T> list(Class<T> type, Predicate<? super T> filter, List<Include<T>> includes) {
            return List.of();
        }

        @Override
        public void stageInsert(Object entity) {
        }

        @Override
        public void stageUpdate(Object entity) {
        }

        @Override
        public void stageRemoval(Object entity) {
        }

        @Override
        public TransactionHandle beginTransaction() {
            return new TransactionHandle() {
                @Override
                public void commit() {
                }

                @Override
                public void rollback() {
                }

                @Override
                public void close() {
                }
            };
        }

        @Override
        public int saveChanges() {
            if (failSave) {
                throw new IllegalStateException("store unavailable");
            }
            return 0;
        }

        @Override
        public void close() {
        }
    }
}

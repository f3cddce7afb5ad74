package io.easyrepo.micrometer;

import io.easyrepo.spi.UnitOfWorkMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link UnitOfWorkMetrics}.
 *
 * <p>Registers counters with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code easyrepo.transaction.begin} — transactions opened</li>
 *   <li>{@code easyrepo.transaction.commit} — transactions committed</li>
 *   <li>{@code easyrepo.transaction.commit.failure} — commits failed in the store</li>
 *   <li>{@code easyrepo.transaction.validation.failure} — commits rejected by validation</li>
 *   <li>{@code easyrepo.transaction.rollback} — transactions rolled back</li>
 *   <li>{@code easyrepo.context.close.failure} — persistence contexts that failed to close</li>
 * </ul>
 *
 * <p>One instance may be shared by every unit of work of a factory.
 *
 * @see UnitOfWorkMetrics
 */
public final class MicrometerUnitOfWorkMetrics implements UnitOfWorkMetrics, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter begun;
    private final Counter committed;
    private final Counter commitFailures;
    private final Counter validationFailures;
    private final Counter rolledBack;
    private final Counter closeFailures;
    private volatile boolean closed;

    /**
     * Creates metrics with the default name prefix {@code "easyrepo"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerUnitOfWorkMetrics(MeterRegistry registry) {
        this(registry, "easyrepo");
    }

    /**
     * Creates metrics with a custom name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "orders.easyrepo"})
     */
    public MicrometerUnitOfWorkMetrics(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.begun = Counter.builder(namePrefix + ".transaction.begin")
                .description("Transactions opened")
                .register(registry);
        this.committed = Counter.builder(namePrefix + ".transaction.commit")
                .description("Transactions committed")
                .register(registry);
        this.commitFailures = Counter.builder(namePrefix + ".transaction.commit.failure")
                .description("Commits that failed in the store")
                .register(registry);
        this.validationFailures = Counter.builder(namePrefix + ".transaction.validation.failure")
                .description("Commits rejected because staged entities were invalid")
                .register(registry);
        this.rolledBack = Counter.builder(namePrefix + ".transaction.rollback")
                .description("Transactions rolled back")
                .register(registry);
        this.closeFailures = Counter.builder(namePrefix + ".context.close.failure")
                .description("Persistence contexts that failed to close")
                .register(registry);
    }

    @Override
    public void incrementTransactionsBegun() {
        if (closed) return;
        begun.increment();
    }

    @Override
    public void incrementCommits() {
        if (closed) return;
        committed.increment();
    }

    @Override
    public void incrementCommitFailures() {
        if (closed) return;
        commitFailures.increment();
    }

    @Override
    public void incrementValidationFailures() {
        if (closed) return;
        validationFailures.increment();
    }

    @Override
    public void incrementRollbacks() {
        if (closed) return;
        rolledBack.increment();
    }

    @Override
    public void incrementCloseFailures() {
        if (closed) return;
        closeFailures.increment();
    }

    /**
     * Removes all meters registered by this instance from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(begun, committed, commitFailures, validationFailures, rolledBack, closeFailures)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}

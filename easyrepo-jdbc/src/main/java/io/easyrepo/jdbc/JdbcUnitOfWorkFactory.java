package io.easyrepo.jdbc;

import io.easyrepo.DefaultUnitOfWork;
import io.easyrepo.UnitOfWork;
import io.easyrepo.UnitOfWorkFactory;
import io.easyrepo.jdbc.dialect.Dialects;
import io.easyrepo.jdbc.mapping.EntityMapping;
import io.easyrepo.jdbc.mapping.EntityMappings;
import io.easyrepo.jdbc.spi.ConnectionProvider;
import io.easyrepo.jdbc.spi.Dialect;
import io.easyrepo.spi.UnitOfWorkMetrics;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Creates {@link UnitOfWork}s backed by a fresh {@link JdbcPersistenceContext}.
 *
 * <pre>{@code
 * JdbcUnitOfWorkFactory<Long> factory = JdbcUnitOfWorkFactory.builder(Long.class)
 *     .dataSource(dataSource)
 *     .mapping(customers)
 *     .mapping(orders)
 *     .build();
 *
 * try (UnitOfWork<Long> uow = factory.create()) {
 *     uow.beginTransaction();
 *     uow.repository().add(customer);
 *     uow.commitTransaction();
 * }
 * }</pre>
 *
 * <p>Thread-safe; each created unit of work is confined to one thread.
 *
 * @param <K> identifier type of the created repositories
 */
public final class JdbcUnitOfWorkFactory<K> implements UnitOfWorkFactory<K> {
    private final ConnectionProvider connectionProvider;
    private final EntityMappings mappings;
    private final Dialect dialect;
    private final UnitOfWorkMetrics metrics;

    private JdbcUnitOfWorkFactory(Builder<K> builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.mappings = builder.mappings != null
                ? builder.mappings
                : EntityMappings.of(builder.mappingList);
        this.dialect = builder.dialect != null ? builder.dialect : Dialects.detect(connectionProvider);
        this.metrics = builder.metrics != null ? builder.metrics : UnitOfWorkMetrics.NOOP;
    }

    /**
     * @param keyType identifier type of the created repositories
     */
    public static <K> Builder<K> builder(Class<K> keyType) {
        Objects.requireNonNull(keyType, "keyType");
        return new Builder<>();
    }

    @Override
    public UnitOfWork<K> create() {
        return new DefaultUnitOfWork<>(new JdbcPersistenceContext(connectionProvider, mappings, dialect), metrics);
    }

    public EntityMappings mappings() {
        return mappings;
    }

    public Dialect dialect() {
        return dialect;
    }

    /** Builder for {@link JdbcUnitOfWorkFactory}. */
    public static final class Builder<K> {
        private ConnectionProvider connectionProvider;
        private EntityMappings mappings;
        private final List<EntityMapping<?>> mappingList = new ArrayList<>();
        private Dialect dialect;
        private UnitOfWorkMetrics metrics;

        private Builder() {}

        public Builder<K> connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        public Builder<K> dataSource(DataSource dataSource) {
            this.connectionProvider = new DataSourceConnectionProvider(dataSource);
            return this;
        }

        /** Uses a prepared registry; individual {@link #mapping} calls are then ignored. */
        public Builder<K> mappings(EntityMappings mappings) {
            this.mappings = mappings;
            return this;
        }

        public Builder<K> mapping(EntityMapping<?> mapping) {
            this.mappingList.add(Objects.requireNonNull(mapping, "mapping"));
            return this;
        }

        /** Optional; detected from the connection URL when not set. */
        public Builder<K> dialect(Dialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder<K> metrics(UnitOfWorkMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public JdbcUnitOfWorkFactory<K> build() {
            return new JdbcUnitOfWorkFactory<>(this);
        }
    }
}

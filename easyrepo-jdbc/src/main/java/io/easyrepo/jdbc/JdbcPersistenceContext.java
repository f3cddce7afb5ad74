package io.easyrepo.jdbc;

import io.easyrepo.Include;
import io.easyrepo.jdbc.mapping.Association;
import io.easyrepo.jdbc.mapping.Column;
import io.easyrepo.jdbc.mapping.EntityMapping;
import io.easyrepo.jdbc.mapping.EntityMappings;
import io.easyrepo.jdbc.spi.ConnectionProvider;
import io.easyrepo.jdbc.spi.Dialect;
import io.easyrepo.spi.EntityValidationException;
import io.easyrepo.spi.EntityValidationResult;
import io.easyrepo.spi.FieldValidationError;
import io.easyrepo.spi.PersistenceContext;
import io.easyrepo.spi.TransactionHandle;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link PersistenceContext} over a single JDBC connection.
 *
 * <p>The connection is obtained lazily on first use and held until {@link #close()}.
 * Outside a transaction statements run in auto-commit mode. Staged changes are kept
 * in a change tracker and written in staging order by {@link #saveChanges()}, after
 * every added or modified entity has passed its mapping's constraints.
 *
 * <p>Filters are evaluated in memory over the rows of the entity's table.
 * Includes are loaded with one {@code IN} query per association.
 *
 * <p>Not thread-safe.
 *
 * @see JdbcUnitOfWorkFactory
 */
public final class JdbcPersistenceContext implements PersistenceContext {
    private static final Logger logger = Logger.getLogger(JdbcPersistenceContext.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EntityMappings mappings;
    private final Dialect dialect;
    private final ChangeTracker tracker = new ChangeTracker();
    private final List<Runnable> generatedIdResets = new ArrayList<>();
    private Connection connection;
    private JdbcTransactionHandle transaction;
    private boolean closed;

    public JdbcPersistenceContext(ConnectionProvider connectionProvider, EntityMappings mappings, Dialect dialect) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.mappings = Objects.requireNonNull(mappings, "mappings");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    /** Number of staged changes not yet written. */
    public int pendingChanges() {
        return tracker.size();
    }

    @Override
    public <T> Optional<T> find(Class<T> type, Object id) {
        ensureOpen();
        EntityMapping<T> mapping = mappings.forType(type);
        Optional<ChangeTracker.Entry> staged = tracker.find(mapping, id);
        if (staged.isPresent()) {
            ChangeTracker.Entry entry = staged.get();
            return entry.state == ChangeTracker.EntityState.DELETED
                    ? Optional.empty()
                    : Optional.of(type.cast(entry.entity));
        }
        List<T> rows = JdbcTemplate.query(connection(), dialect.selectByIdSql(mapping), mapping::read, id);
        return rows.stream().findFirst();
    }

    @Override
    public <T> List<T> list(Class<T> type, Predicate<? super T> filter, List<Include<T>> includes) {
        ensureOpen();
        EntityMapping<T> mapping = mappings.forType(type);
        List<T> result = new ArrayList<>();
        for (T entity : JdbcTemplate.query(connection(), dialect.selectAllSql(mapping), mapping::read)) {
            if (filter.test(entity)) {
                result.add(entity);
            }
        }
        List<Association<T, ?>> associations = new ArrayList<>(includes.size());
        for (Include<T> include : includes) {
            associations.add(mapping.association(include.name())
                    .orElseThrow(() -> new DataStoreException(
                            "No association '" + include.name() + "' mapped on " + type.getName())));
        }
        if (!result.isEmpty()) {
            for (Association<T, ?> association : associations) {
                load(mapping, result, association);
            }
        }
        return result;
    }

    @Override
    public void stageInsert(Object entity) {
        ensureOpen();
        tracker.add(entity, mappings.forEntity(entity));
    }

    @Override
    public void stageUpdate(Object entity) {
        ensureOpen();
        EntityMapping<?> mapping = mappings.forEntity(entity);
        requireId(mapping, entity, "update");
        tracker.update(entity, mapping);
    }

    @Override
    public void stageRemoval(Object entity) {
        ensureOpen();
        EntityMapping<?> mapping = mappings.forEntity(entity);
        requireId(mapping, entity, "remove");
        tracker.remove(entity, mapping);
    }

    @Override
    public TransactionHandle beginTransaction() {
        ensureOpen();
        if (transaction != null) {
            throw new DataStoreException("Transaction already active");
        }
        Connection conn = connection();
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            throw new DataStoreException("Failed to begin transaction: " + e.getMessage(), e);
        }
        transaction = new JdbcTransactionHandle(this, conn);
        return transaction;
    }

    @Override
    public int saveChanges() {
        ensureOpen();
        List<ChangeTracker.Entry> pending = tracker.entries();
        if (pending.isEmpty()) {
            return 0;
        }
        List<EntityValidationResult> invalid = new ArrayList<>();
        for (ChangeTracker.Entry entry : pending) {
            if (entry.state != ChangeTracker.EntityState.DELETED) {
                List<FieldValidationError> errors = validate(entry.mapping, entry.entity);
                if (!errors.isEmpty()) {
                    invalid.add(new EntityValidationResult(entry.entity, errors));
                }
            }
        }
        if (!invalid.isEmpty()) {
            throw new EntityValidationException(invalid);
        }
        Connection conn = connection();
        for (ChangeTracker.Entry entry : pending) {
            switch (entry.state) {
                case ADDED -> insert(conn, entry.mapping, entry.entity);
                case MODIFIED -> update(conn, entry.mapping, entry.entity);
                case DELETED -> delete(conn, entry.mapping, entry.entity);
            }
        }
        tracker.clear();
        logger.log(Level.FINE, "Flushed {0} staged changes", pending.size());
        return pending.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (transaction != null) {
            discardChanges();
        }
        tracker.clear();
        transaction = null;
        Connection conn = connection;
        connection = null;
        if (conn == null) {
            return;
        }
        try (conn) {
            if (!conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw new DataStoreException("Failed to close connection: " + e.getMessage(), e);
        }
    }

    void discardChanges() {
        tracker.clear();
        for (Runnable reset : generatedIdResets) {
            reset.run();
        }
        generatedIdResets.clear();
    }

    void transactionEnded(JdbcTransactionHandle handle) {
        if (transaction == handle) {
            transaction = null;
        }
        generatedIdResets.clear();
    }

    private Connection connection() {
        if (connection == null) {
            try {
                connection = connectionProvider.getConnection();
            } catch (SQLException e) {
                throw new DataStoreException("Failed to obtain connection: " + e.getMessage(), e);
            }
        }
        return connection;
    }

    private void ensureOpen() {
        if (closed) {
            throw new DataStoreException("Persistence context is closed");
        }
    }

    private static <T> void requireId(EntityMapping<T> mapping, Object entity, String operation) {
        if (mapping.idOf(mapping.type().cast(entity)) == null) {
            throw new DataStoreException("Cannot " + operation + " " + entity.getClass().getName() +
                    " without an id");
        }
    }

    private static <T> List<FieldValidationError> validate(EntityMapping<T> mapping, Object entity) {
        return mapping.validate(mapping.type().cast(entity));
    }

    private <T> void insert(Connection conn, EntityMapping<T> mapping, Object entity) {
        T typed = mapping.type().cast(entity);
        List<Object> params = new ArrayList<>();
        if (!mapping.isIdGenerated()) {
            params.add(mapping.idOf(typed));
        }
        for (Column<T> column : mapping.columns()) {
            params.add(column.get(typed));
        }
        String sql = dialect.insertSql(mapping);
        if (mapping.isIdGenerated()) {
            Object id = JdbcTemplate.insertReturningKey(conn, sql, keys -> dialect.generatedKey(keys, mapping),
                            params.toArray())
                    .orElseThrow(() -> new DataStoreException(
                            "No generated key returned for " + mapping.table()));
            mapping.idColumn().set(typed, id);
            if (transaction != null) {
                // cleared again if the transaction rolls back
                generatedIdResets.add(() -> mapping.idColumn().set(typed, null));
            }
        } else {
            JdbcTemplate.update(conn, sql, params.toArray());
        }
    }

    private <T> void update(Connection conn, EntityMapping<T> mapping, Object entity) {
        T typed = mapping.type().cast(entity);
        List<Object> params = new ArrayList<>();
        for (Column<T> column : mapping.columns()) {
            params.add(column.get(typed));
        }
        Object id = mapping.idOf(typed);
        params.add(id);
        expectOneRow(JdbcTemplate.update(conn, dialect.updateSql(mapping), params.toArray()), "update", mapping, id);
    }

    private <T> void delete(Connection conn, EntityMapping<T> mapping, Object entity) {
        Object id = mapping.idOf(mapping.type().cast(entity));
        expectOneRow(JdbcTemplate.update(conn, dialect.deleteSql(mapping), id), "delete", mapping, id);
    }

    private static void expectOneRow(int rows, String operation, EntityMapping<?> mapping, Object id) {
        if (rows != 1) {
            throw new DataStoreException("Expected to " + operation + " 1 row of " + mapping.table() +
                    " with id " + id + " but affected " + rows);
        }
    }

    private <T, R> void load(EntityMapping<T> owner, List<T> owners, Association<T, R> association) {
        EntityMapping<R> target = mappings.forType(association.target());
        switch (association.kind()) {
            case ONE_TO_MANY -> loadCollection(owner, owners, association, target);
            case MANY_TO_ONE -> loadReference(owners, association, target);
        }
    }

    private <T, R> void loadCollection(EntityMapping<T> owner, List<T> owners, Association<T, R> association,
                                       EntityMapping<R> target) {
        Column<R> foreignKey = target.column(association.foreignKeyColumn())
                .orElseThrow(() -> new DataStoreException("Column " + association.foreignKeyColumn() +
                        " is not mapped on " + target.type().getName()));
        Set<Object> ids = new LinkedHashSet<>();
        for (T entity : owners) {
            ids.add(owner.idOf(entity));
        }
        List<R> related = JdbcTemplate.query(connection(),
                dialect.selectWhereInSql(target, foreignKey.name(), ids.size()), target::read, ids.toArray());
        Map<Object, List<R>> byOwner = new LinkedHashMap<>();
        for (R row : related) {
            byOwner.computeIfAbsent(foreignKey.get(row), k -> new ArrayList<>()).add(row);
        }
        for (T entity : owners) {
            association.assignCollection(entity, byOwner.getOrDefault(owner.idOf(entity), new ArrayList<>()));
        }
    }

    private <T, R> void loadReference(List<T> owners, Association<T, R> association, EntityMapping<R> target) {
        Set<Object> ids = new LinkedHashSet<>();
        for (T entity : owners) {
            Object foreignKey = association.foreignKeyOf(entity);
            if (foreignKey != null) {
                ids.add(foreignKey);
            }
        }
        if (ids.isEmpty()) {
            return;
        }
        List<R> related = JdbcTemplate.query(connection(),
                dialect.selectWhereInSql(target, target.idColumn().name(), ids.size()), target::read, ids.toArray());
        Map<Object, R> byId = new LinkedHashMap<>();
        for (R row : related) {
            byId.put(target.idOf(row), row);
        }
        for (T entity : owners) {
            Object foreignKey = association.foreignKeyOf(entity);
            if (foreignKey != null) {
                association.assignReference(entity, byId.get(foreignKey));
            }
        }
    }
}
